package com.questrail.tictactoe.runtime;

import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.config.SessionConfig;
import com.questrail.tictactoe.participant.AiParticipant;
import com.questrail.tictactoe.participant.MinimaxMovePolicy;
import com.questrail.tictactoe.participant.RandomMovePolicy;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Parsed command line of {@link GameLauncher}.
 *
 * <pre>
 *   --mode local  --player-x easy-ai|hard-ai --player-o easy-ai|hard-ai
 *   --mode host   --player easy-ai|hard-ai [--symbol X|O|random] [--port N] [--accept-timeout SECONDS]
 *   --mode client --player easy-ai|hard-ai [--host H] [--port N]
 *   common:       [--seed N] [--game-timeout SECONDS]
 * </pre>
 *
 * @param hostSymbol {@code null} means drawn at random; only used in host mode
 * @param seed       {@code null} means unseeded
 */
public record LaunchOptions(
    Mode mode,
    PlayerType playerX,
    PlayerType playerO,
    PlayerType player,
    Symbol hostSymbol,
    SessionConfig session,
    Long seed,
    Duration gameTimeout
) {
    public static final Duration DEFAULT_GAME_TIMEOUT = Duration.ofMinutes(5);

    public enum Mode
    {
        LOCAL, HOST, CLIENT
    }

    /**
     * Computer players selectable from the command line.
     */
    public enum PlayerType
    {
        EASY_AI("easy-ai"),
        HARD_AI("hard-ai");

        private final String flag;

        PlayerType(String flag)
        {
            this.flag = flag;
        }

        public String flag()
        {
            return flag;
        }

        static PlayerType fromFlag(String value)
        {
            for (PlayerType type : values()) {
                if (type.flag.equals(value)) {
                    return type;
                }
            }
            if ("human".equals(value)) {
                throw new IllegalArgumentException("human players need an interactive front end; use easy-ai or hard-ai");
            }
            throw new IllegalArgumentException("Unknown player type: " + value);
        }

        ParticipantFactory factory(Random random)
        {
            switch (this) {
                case EASY_AI:
                    return (bus, s) -> new AiParticipant(bus, s, new RandomMovePolicy(random));
                case HARD_AI:
                    return (bus, s) -> new AiParticipant(bus, s, new MinimaxMovePolicy());
                default:
                    throw new IllegalStateException("Unhandled player type " + this);
            }
        }
    }

    public LaunchOptions {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(gameTimeout, "gameTimeout");
        if (mode == Mode.LOCAL) {
            Objects.requireNonNull(playerX, "playerX");
            Objects.requireNonNull(playerO, "playerO");
        } else {
            Objects.requireNonNull(player, "player");
        }
    }

    /**
     * @throws IllegalArgumentException on an unknown flag, a missing value or
     *                                  a flag that does not apply to the mode
     */
    public static LaunchOptions parse(String... args)
    {
        Mode mode = null;
        PlayerType playerX = null;
        PlayerType playerO = null;
        PlayerType player = null;
        Symbol hostSymbol = null;
        boolean symbolGiven = false;
        Long seed = null;
        Duration gameTimeout = DEFAULT_GAME_TIMEOUT;
        SessionConfig.Builder session = SessionConfig.builder();

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (!flag.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + flag);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String value = args[++i];

            switch (flag) {
                case "--mode":
                    mode = parseMode(value);
                    break;
                case "--player-x":
                    playerX = PlayerType.fromFlag(value);
                    break;
                case "--player-o":
                    playerO = PlayerType.fromFlag(value);
                    break;
                case "--player":
                    player = PlayerType.fromFlag(value);
                    break;
                case "--symbol":
                    hostSymbol = "random".equalsIgnoreCase(value) ? null : parseSymbol(value);
                    symbolGiven = true;
                    break;
                case "--host":
                    session.withHost(value);
                    break;
                case "--port":
                    session.withPort(parseInt(flag, value));
                    break;
                case "--accept-timeout":
                    session.withAcceptTimeout(Duration.ofSeconds(parseInt(flag, value)));
                    break;
                case "--seed":
                    seed = parseLong(flag, value);
                    break;
                case "--game-timeout":
                    gameTimeout = Duration.ofSeconds(parseInt(flag, value));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }

        if (mode == null) {
            throw new IllegalArgumentException("--mode is required (local, host or client)");
        }
        if (mode == Mode.LOCAL) {
            if (playerX == null || playerO == null) {
                throw new IllegalArgumentException("local mode requires --player-x and --player-o");
            }
            if (player != null) {
                throw new IllegalArgumentException("--player applies to host and client modes");
            }
        } else {
            if (player == null) {
                throw new IllegalArgumentException(mode.name().toLowerCase(Locale.ROOT) + " mode requires --player");
            }
            if (playerX != null || playerO != null) {
                throw new IllegalArgumentException("--player-x and --player-o apply to local mode");
            }
        }
        if (symbolGiven && mode != Mode.HOST) {
            throw new IllegalArgumentException("--symbol applies to host mode; the host assigns the client's symbol");
        }

        return new LaunchOptions(mode, playerX, playerO, player, hostSymbol, session.build(), seed, gameTimeout);
    }

    Random random()
    {
        return seed == null ? new Random() : new Random(seed);
    }

    private static Mode parseMode(String value)
    {
        try {
            return Mode.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode: " + value, e);
        }
    }

    private static Symbol parseSymbol(String value)
    {
        try {
            return Symbol.parse(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Symbol must be X, O or random: " + value, e);
        }
    }

    private static int parseInt(String flag, String value)
    {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number: " + value, e);
        }
    }

    private static long parseLong(String flag, String value)
    {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number: " + value, e);
        }
    }
}
