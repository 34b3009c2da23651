package com.polcard.engine;

import com.polcard.engine.card.Catalog;
import com.polcard.engine.card.CatalogException;
import com.polcard.engine.config.EngineConfig;
import com.polcard.engine.deck.Deck;
import com.polcard.engine.deck.DeckException;
import com.polcard.engine.deck.DeckRepository;
import com.polcard.engine.deck.PlayerDecks;
import com.polcard.engine.engine.GameOrchestrator;
import com.polcard.engine.engine.InMemoryGameStore;
import com.polcard.engine.engine.ScenarioService;
import com.polcard.engine.game.GameState;
import com.polcard.engine.game.GameStateCodec;
import com.polcard.engine.rng.GameRng;
import com.polcard.engine.simulation.GameResult;
import com.polcard.engine.simulation.SimulationEngine;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.stream.IntStream;

/**
 * Political card game engine CLI - Main entry point.
 */
@Command(name = "polcard-engine",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Rules engine of a two-player political card game",
        subcommands = {
                Main.ScenarioCommand.class,
                Main.ValidateDecksCommand.class,
                Main.SimulateCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== SCENARIO COMMAND ==========
    @Command(name = "scenario", description = "Print the state of a test scenario as JSON")
    static class ScenarioCommand implements Callable<Integer> {
        @Parameters(index = "0", arity = "0..1", defaultValue = ScenarioService.SIMPLE_TEST,
                description = "Scenario id (default: ${DEFAULT-VALUE})")
        String scenarioId;

        @Option(names = {"-c", "--cards"},
                description = "Directory holding the card tables (default: bundled catalog)")
        Path cardsDir;

        @Override
        public Integer call() throws Exception {
            Catalog catalog = loadCatalog(cardsDir);
            DeckRepository decks = loadDecks(null);
            if (catalog == null || decks == null) {
                return 1;
            }
            GameOrchestrator orchestrator = new GameOrchestrator(catalog, decks, EngineConfig.load(),
                    new InMemoryGameStore(), Clock.systemUTC(), new GameRng());
            GameState state;
            try {
                state = new ScenarioService(orchestrator).load(scenarioId);
            } catch (IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }
            System.out.println(GameStateCodec.toPrettyJson(state));
            return 0;
        }
    }

    // ========== VALIDATE-DECKS COMMAND ==========
    @Command(name = "validate-decks", description = "Validate every deck in a deck file")
    static class ValidateDecksCommand implements Callable<Integer> {
        @Parameters(index = "0", arity = "0..1",
                description = "Deck file (default: bundled decks)")
        Path deckFile;

        @Option(names = {"-c", "--cards"},
                description = "Directory holding the card tables (default: bundled catalog)")
        Path cardsDir;

        @Override
        public Integer call() throws Exception {
            DeckRepository decks = loadDecks(deckFile);
            Catalog catalog = loadCatalog(cardsDir);
            if (decks == null || catalog == null) {
                return 1;
            }

            System.out.println("\n=== Deck Validation ===\n");
            int invalid = 0;
            Map<String, List<String>> errors = decks.validateAll();
            for (String playerId : decks.playerIds()) {
                PlayerDecks playerDecks = decks.playerDecks(playerId).orElseThrow();
                for (Map.Entry<String, Deck> entry : playerDecks.getDecks().entrySet()) {
                    Deck deck = entry.getValue();
                    List<String> problems = new ArrayList<>(
                            errors.getOrDefault(playerId + "/" + entry.getKey(), List.of()));
                    problems.addAll(unknownCards(catalog, deck));
                    Deck.DeckStats stats = deck.stats();
                    String marker = problems.isEmpty() ? "✓" : "✗";
                    System.out.printf("%s %-12s %-10s %-12s %2d cards %s, %d leaders%n",
                            marker, playerId, entry.getKey(), deck.getName(), stats.totalCards(),
                            stats.cardTypes(), stats.totalLeaders());
                    for (String problem : problems) {
                        System.out.println("    - " + problem);
                    }
                    if (!problems.isEmpty()) {
                        invalid++;
                    }
                }
            }
            System.out.println();
            if (invalid > 0) {
                System.err.println("✗ " + invalid + " invalid deck(s)");
                return 1;
            }
            System.out.println("All decks valid");
            return 0;
        }

        private static List<String> unknownCards(Catalog catalog, Deck deck) {
            List<String> problems = new ArrayList<>();
            for (String cardId : deck.getCards()) {
                if (!catalog.hasCard(cardId)) {
                    problems.add("Unknown card: " + cardId);
                }
            }
            for (String leaderId : deck.getLeader()) {
                if (catalog.findLeader(leaderId).isEmpty()) {
                    problems.add("Unknown leader: " + leaderId);
                }
            }
            return problems;
        }
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Play games between random players")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-games"}, defaultValue = "100",
                description = "Number of games to simulate")
        int numGames;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-d", "--decks"},
                description = "Deck file (default: bundled decks)")
        Path deckFile;

        @Option(names = {"-c", "--cards"},
                description = "Directory holding the card tables (default: bundled catalog)")
        Path cardsDir;

        @Override
        public Integer call() throws Exception {
            Catalog catalog = loadCatalog(cardsDir);
            DeckRepository decks = loadDecks(deckFile);
            if (catalog == null || decks == null) {
                return 1;
            }
            EngineConfig config = EngineConfig.load();

            System.out.println("\n=== Political Card Game Simulator ===\n");
            System.out.println("Games: " + numGames);
            if (seed != null) {
                System.out.println("Seed: " + seed);
            }
            System.out.println();

            long startTime = System.currentTimeMillis();
            List<GameResult> results = runSimulations(catalog, decks, config, numGames, seed);
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, numGames, elapsed);
            return 0;
        }
    }

    // ========== HELPER METHODS ==========

    private static Catalog loadCatalog(Path cardsDir) {
        try {
            Catalog catalog = cardsDir != null ? Catalog.fromDirectory(cardsDir) : Catalog.fromResources();
            System.err.println("✓ Loaded " + catalog.cardCount() + " cards");
            return catalog;
        } catch (CatalogException e) {
            System.err.println("✗ Failed to load cards: " + e.getMessage());
            return null;
        }
    }

    private static DeckRepository loadDecks(Path deckFile) {
        try {
            return deckFile != null ? DeckRepository.fromFile(deckFile) : DeckRepository.fromResources();
        } catch (DeckException e) {
            System.err.println("✗ Failed to load decks: " + e.getMessage());
            return null;
        }
    }

    /**
     * Run simulations and return results.
     */
    private static List<GameResult> runSimulations(Catalog catalog, DeckRepository decks, EngineConfig config,
                                                   int count, Long seed) {
        if (seed != null) {
            // Sequential with fixed seed
            List<GameResult> results = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                results.add(SimulationEngine.runGame(catalog, decks, config, seed + i));
            }
            return results;
        }
        // Parallel with random seeds
        return IntStream.range(0, count)
                .parallel()
                .mapToObj(i -> SimulationEngine.runGame(catalog, decks, config, System.nanoTime() + i))
                .toList();
    }

    /**
     * Print simulation results.
     */
    private static void printResults(List<GameResult> results, int numGames, long elapsedMs) {
        Map<String, Long> outcomes = new TreeMap<>();
        Map<Integer, Long> roundDist = new TreeMap<>();
        for (GameResult r : results) {
            String outcome = !r.isFinished() ? "unfinished" : r.isDraw() ? "draw" : r.winner();
            outcomes.merge(outcome, 1L, Long::sum);
            if (r.isFinished()) {
                roundDist.merge(r.rounds(), 1L, Long::sum);
            }
        }
        double avgTurns = results.stream().filter(GameResult::isFinished)
                .mapToDouble(GameResult::finalTurn).average().orElse(0.0);
        long rejected = results.stream().mapToLong(GameResult::rejected).sum();

        System.out.println("=== Results ===\n");
        for (Map.Entry<String, Long> entry : outcomes.entrySet()) {
            double pct = (double) entry.getValue() / numGames * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  %-12s %5.1f%% %s (%d)%n", entry.getKey(), pct, bar, entry.getValue());
        }
        System.out.println();
        System.out.printf("Average final turn: %.2f%n", avgTurns);
        System.out.println("Rounds played:");
        for (Map.Entry<Integer, Long> entry : roundDist.entrySet()) {
            double pct = (double) entry.getValue() / numGames * 100.0;
            System.out.printf("  Round %d: %5.1f%% (%d)%n", entry.getKey(), pct, entry.getValue());
        }
        if (rejected > 0) {
            System.out.println("Rejected actions: " + rejected);
        }

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double gamesPerSec = elapsedSec > 0 ? numGames / elapsedSec : 0;
        System.out.printf("Simulation completed in %.2fs (%.0f games/sec)%n", elapsedSec, gamesPerSec);
    }
}
