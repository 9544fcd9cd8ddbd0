package com.questrail.tictactoe.bus;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.Move;
import com.questrail.tictactoe.api.MoveError;
import com.questrail.tictactoe.api.Symbol;

import java.util.Objects;
import java.util.Optional;

/**
 * GameEvent
 * -----------------------------------------------------------------------------
 * Closed set of events exchanged on the {@link EventBus}.
 *
 * <h2>Role in the architecture</h2>
 * Events are the only way information moves between the turn engine, the
 * participants and the front ends. The network bridge serializes a subset of
 * them onto the wire and re-publishes them on the other peer's bus.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Events are immutable</li>
 *   <li>Events carry snapshots, never live state</li>
 *   <li>Subscribers dispatch on the concrete record type</li>
 * </ul>
 */
public sealed interface GameEvent
        permits GameEvent.MoveRequested,
                GameEvent.StateUpdated,
                GameEvent.StartTurn,
                GameEvent.DecisionDue,
                GameEvent.EnableInput,
                GameEvent.InvalidMove,
                GameEvent.InputError,
                GameEvent.SessionEnded
{
    /** A participant asks to place its symbol. */
    record MoveRequested(Symbol player, int row, int col) implements GameEvent {
        public MoveRequested {
            Objects.requireNonNull(player, "player");
        }

        public Move toMove() {
            return new Move(player, row, col);
        }
    }

    /** The board changed, or the game was (re)started. {@code winner} is {@code null} while undecided. */
    record StateUpdated(BoardSnapshot board, Symbol currentPlayer, Symbol winner) implements GameEvent {
        public StateUpdated {
            Objects.requireNonNull(board, "board");
            Objects.requireNonNull(currentPlayer, "currentPlayer");
        }

        public Optional<Symbol> winnerIfAny() {
            return Optional.ofNullable(winner);
        }

        public boolean isGameOver() {
            return winner != null || board.isFull();
        }
    }

    /** {@code player} may now move. Never published once the game is over. */
    record StartTurn(Symbol player, BoardSnapshot board) implements GameEvent {
        public StartTurn {
            Objects.requireNonNull(player, "player");
            Objects.requireNonNull(board, "board");
        }
    }

    /**
     * A {@link StartTurn} handed to the bus worker for a player whose decision
     * is slow to compute. Published with {@link EventBus#publishAsync}.
     */
    record DecisionDue(Symbol player, BoardSnapshot board) implements GameEvent {
        public DecisionDue {
            Objects.requireNonNull(player, "player");
            Objects.requireNonNull(board, "board");
        }
    }

    /** Front ends should accept input for {@code player}. */
    record EnableInput(Symbol player) implements GameEvent {
        public EnableInput {
            Objects.requireNonNull(player, "player");
        }
    }

    /** A requested move was rejected by the authoritative engine. */
    record InvalidMove(Symbol player, int row, int col, MoveError error, String message) implements GameEvent {
        public InvalidMove {
            Objects.requireNonNull(player, "player");
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(message, "message");
        }

        public static InvalidMove of(MoveRequested request, MoveError error) {
            return new InvalidMove(request.player(), request.row(), request.col(), error, error.description());
        }
    }

    /** User-facing explanation of a rejected move. */
    record InputError(Symbol player, String message) implements GameEvent {
        public InputError {
            Objects.requireNonNull(player, "player");
            Objects.requireNonNull(message, "message");
        }
    }

    /** The network session is over; no further updates will arrive. */
    record SessionEnded(String reason) implements GameEvent {
        public SessionEnded {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
