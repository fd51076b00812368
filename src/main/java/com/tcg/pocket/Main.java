package com.tcg.pocket;

import com.tcg.pocket.card.CardDatabase;
import com.tcg.pocket.card.CardDatabaseException;
import com.tcg.pocket.config.RulesConfig;
import com.tcg.pocket.game.MatchResult;
import com.tcg.pocket.simulation.DeckList;
import com.tcg.pocket.simulation.DeckValidator;
import com.tcg.pocket.simulation.GameEngine;
import com.tcg.pocket.simulation.InvalidDeckException;
import com.tcg.pocket.simulation.MatchSummary;
import com.tcg.pocket.simulation.RandomPlayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Pocket engine CLI - Main entry point.
 *
 * Exit codes: 0 on success, 1 for an invalid deck, 2 when the card database
 * or rules cannot be loaded (and for usage errors).
 */
@Command(name = "pocket-engine",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Deterministic Pocket battle simulator",
        subcommands = {
                Main.SimulateCommand.class,
                Main.CheckDeckCommand.class
        })
public class Main implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_DECK = 1;
    static final int EXIT_LOAD_FAILURE = 2;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    /**
     * Options shared by every subcommand that needs cards and rules.
     */
    static class DataOptions {
        @Option(names = {"-c", "--cards"},
                description = "Path to a cards JSON file (default: bundled card pool)")
        String cardsPath;

        @Option(names = {"-r", "--rules"},
                description = "Path to a rules JSON file (default: bundled rules)")
        String rulesPath;

        CardDatabase loadCards() throws CardDatabaseException {
            CardDatabase db = cardsPath != null ? CardDatabase.fromFile(cardsPath) : CardDatabase.defaultDatabase();
            log.info("Loaded {} cards from {}", db.cardCount(), cardsPath != null ? cardsPath : "bundled pool");
            return db;
        }

        RulesConfig loadRules() throws IOException {
            return rulesPath != null
                ? RulesConfig.fromFile(Path.of(rulesPath))
                : RulesConfig.fromResource(RulesConfig.DEFAULT_RESOURCE);
        }
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Play random self-play matches between two decks")
    static class SimulateCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Deck file of player A")
        String deckAPath;

        @Parameters(index = "1", description = "Deck file of player B")
        String deckBPath;

        @Option(names = {"-n", "--num-games"}, defaultValue = "1000",
                description = "Number of matches to play")
        int numGames;

        @Option(names = {"-s", "--seed"}, defaultValue = "1",
                description = "Seed of the first match; match i uses seed + i")
        long seed;

        @Option(names = {"-t", "--threads"},
                description = "Worker threads (default: available processors)")
        Integer threads;

        @CommandLine.Mixin
        DataOptions data = new DataOptions();

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() throws Exception {
            if (numGames < 1) {
                throw new ParameterException(spec.commandLine(), "--num-games must be at least 1, got " + numGames);
            }
            if (threads != null && threads < 1) {
                throw new ParameterException(spec.commandLine(), "--threads must be at least 1, got " + threads);
            }
            GameEngine engine;
            try {
                engine = new GameEngine(data.loadCards(), data.loadRules());
            } catch (CardDatabaseException | IOException | IllegalArgumentException e) {
                System.err.println("Failed to load game data: " + e.getMessage());
                return EXIT_LOAD_FAILURE;
            }

            DeckList deckA;
            DeckList deckB;
            try {
                deckA = DeckList.loadFromFile(deckAPath);
                deckB = DeckList.loadFromFile(deckBPath);
                DeckValidator.validate(deckA.getCardIds(), engine.getCardDatabase(), engine.getRules());
                DeckValidator.validate(deckB.getCardIds(), engine.getCardDatabase(), engine.getRules());
            } catch (InvalidDeckException e) {
                System.err.println("Invalid deck: " + e.getMessage());
                return EXIT_INVALID_DECK;
            }

            int workers = threads != null ? threads : Runtime.getRuntime().availableProcessors();
            System.out.println("\n=== Pocket Self-Play ===\n");
            System.out.println("Player A: " + deckA.getName());
            System.out.println("Player B: " + deckB.getName());
            System.out.println("Games: " + numGames + " (seeds " + seed + ".." + (seed + numGames - 1) + ")");
            System.out.println();

            long startTime = System.currentTimeMillis();
            List<MatchSummary> results = runMatches(engine, deckA, deckB, numGames, seed, workers);
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, elapsed);
            return EXIT_OK;
        }
    }

    // ========== CHECK-DECK COMMAND ==========
    @Command(name = "check-deck", description = "Check a deck file against the construction rules")
    static class CheckDeckCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Deck file")
        String deckPath;

        @CommandLine.Mixin
        DataOptions data = new DataOptions();

        @Override
        public Integer call() {
            CardDatabase db;
            RulesConfig rules;
            try {
                db = data.loadCards();
                rules = data.loadRules();
            } catch (CardDatabaseException | IOException | IllegalArgumentException e) {
                System.err.println("Failed to load game data: " + e.getMessage());
                return EXIT_LOAD_FAILURE;
            }
            try {
                DeckList deck = DeckList.loadFromFile(deckPath);
                DeckValidator.validate(deck.getCardIds(), db, rules);
                System.out.println(deck.getName() + ": OK (" + deck.size() + " cards)");
                return EXIT_OK;
            } catch (InvalidDeckException e) {
                System.out.println("Invalid deck (" + e.getReason() + "): " + e.getMessage());
                return EXIT_INVALID_DECK;
            }
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Play matches on a fixed thread pool, one match per task. Results come
     * back in seed order whatever the scheduling.
     */
    static List<MatchSummary> runMatches(GameEngine engine, DeckList deckA, DeckList deckB,
                                         int count, long baseSeed, int workers)
            throws InterruptedException, ExecutionException {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, workers));
        try {
            List<Future<MatchSummary>> futures = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                long matchSeed = baseSeed + i;
                futures.add(executor.submit(() ->
                    RandomPlayout.run(engine, matchSeed, deckA.getCardIds(), deckB.getCardIds())));
            }
            List<MatchSummary> results = new ArrayList<>(count);
            for (int i = 0; i < futures.size(); i++) {
                results.add(futures.get(i).get());
                if ((i + 1) % 1000 == 0) {
                    log.info("{} / {} matches done", i + 1, count);
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static void printResults(List<MatchSummary> results, long elapsedMs) {
        int numGames = results.size();
        Map<MatchResult, Long> outcomes = new TreeMap<>();
        Map<Integer, Long> turnDist = new TreeMap<>();
        long totalSteps = 0;
        long totalKnockouts = 0;
        for (MatchSummary r : results) {
            outcomes.merge(r.result(), 1L, Long::sum);
            turnDist.merge(r.turns(), 1L, Long::sum);
            totalSteps += r.steps();
            totalKnockouts += r.knockouts();
        }

        System.out.println("=== Results ===\n");
        for (MatchResult result : List.of(MatchResult.PLAYER_A, MatchResult.PLAYER_B, MatchResult.DRAW)) {
            long n = outcomes.getOrDefault(result, 0L);
            System.out.printf("%-9s %5.1f%% (%d)%n", result, percent(n, numGames), n);
        }
        System.out.println();
        System.out.printf("Average match length: %.2f turns%n",
            results.stream().mapToInt(MatchSummary::turns).average().orElse(0.0));
        System.out.printf("Average knockouts: %.2f%n", numGames > 0 ? (double) totalKnockouts / numGames : 0.0);
        System.out.println();

        System.out.println("Turn distribution:");
        for (Map.Entry<Integer, Long> entry : turnDist.entrySet()) {
            double pct = percent(entry.getValue(), numGames);
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  Turn %3d: %5.1f%% %s (%d)%n", entry.getKey(), pct, bar, entry.getValue());
        }

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double gamesPerSec = elapsedSec > 0 ? numGames / elapsedSec : 0;
        double stepsPerSec = elapsedSec > 0 ? totalSteps / elapsedSec : 0;
        System.out.printf("Simulation completed in %.2fs (%.0f games/sec, %.0f steps/sec)%n",
            elapsedSec, gamesPerSec, stepsPerSec);
    }

    private static double percent(long part, int whole) {
        return whole > 0 ? (double) part / whole * 100.0 : 0.0;
    }
}
