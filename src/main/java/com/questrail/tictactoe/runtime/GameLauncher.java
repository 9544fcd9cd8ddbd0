package com.questrail.tictactoe.runtime;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.GameException;
import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.GameEvent.SessionEnded;
import com.questrail.tictactoe.bus.GameEvent.StateUpdated;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * GameLauncher
 * =============================================================================
 * Command-line entry point. Plays one game in local, host or client mode with
 * computer players and prints each board and the result.
 *
 * <h2>Exit codes</h2>
 * <ul>
 *   <li>{@code 0} - the game was decided</li>
 *   <li>{@code 1} - the session failed or ended undecided</li>
 *   <li>{@code 2} - bad command line</li>
 * </ul>
 *
 * See {@link LaunchOptions} for the flags.
 */
public final class GameLauncher
{
    private static final Logger log = LoggerFactory.getLogger(GameLauncher.class);

    public static final int EXIT_DECIDED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private final PrintStream out;

    public GameLauncher(PrintStream out)
    {
        this.out = out;
    }

    public static void main(String[] args)
    {
        System.exit(new GameLauncher(System.out).run(args));
    }

    public int run(String... args)
    {
        final LaunchOptions options;
        try {
            options = LaunchOptions.parse(args);
        } catch (IllegalArgumentException e) {
            out.println("error: " + e.getMessage());
            out.println("usage: --mode local|host|client [options], see LaunchOptions");
            return EXIT_USAGE;
        }
        return run(options);
    }

    public int run(LaunchOptions options)
    {
        Random random = options.random();
        try (GameSession session = open(options, random)) {
            session.bus().subscribe(StateUpdated.class, this::render);
            session.bus().subscribe(SessionEnded.class, e -> out.println("Session ended: " + e.reason()));
            session.start();

            if (!session.awaitEnd(options.gameTimeout())) {
                out.println("No result within " + options.gameTimeout().toSeconds() + "s");
                return EXIT_FAILED;
            }
            // A client sees the final board before the host closes the connection.
            BoardSnapshot board = session.engine().snapshot();
            if (!board.isFinished()) {
                out.println("Game abandoned");
                return EXIT_FAILED;
            }
            out.println(board.winner().map(w -> w + " wins").orElse("Draw"));
            return EXIT_DECIDED;
        } catch (GameException e) {
            log.error("Game session failed", e);
            out.println("error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("Interrupted");
            return EXIT_FAILED;
        }
    }

    private GameSession open(LaunchOptions options, Random random)
    {
        switch (options.mode()) {
            case LOCAL:
                return GameSessions.local(
                        options.playerX().factory(random),
                        options.playerO().factory(random));
            case HOST:
                try (GameSessions.HostListener listener = GameSessions.listen(options.session())) {
                    Symbol hostSymbol = options.hostSymbol() != null
                            ? options.hostSymbol()
                            : (random.nextBoolean() ? Symbol.X : Symbol.O);
                    out.println("Listening on port " + listener.port() + ", playing " + hostSymbol);
                    return listener.accept(hostSymbol, options.player().factory(random));
                }
            case CLIENT:
                GameSession session = GameSessions.client(options.session(), options.player().factory(random));
                out.println("Connected to " + options.session().host() + ":" + options.session().port());
                return session;
            default:
                throw new IllegalStateException("Unhandled mode " + options.mode());
        }
    }

    private void render(StateUpdated update)
    {
        List<List<Symbol>> rows = update.board().rows();
        String grid = rows.stream()
                .map(row -> row.stream()
                        .map(s -> s == null ? "." : s.name())
                        .collect(Collectors.joining(" | ", " ", " ")))
                .collect(Collectors.joining(System.lineSeparator() + "---+---+---" + System.lineSeparator()));
        out.println(grid);
        if (!update.isGameOver()) {
            out.println(update.currentPlayer() + " to move");
        }
        out.println();
    }
}
