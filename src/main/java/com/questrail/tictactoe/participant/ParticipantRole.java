package com.questrail.tictactoe.participant;

/**
 * Who may mutate the turn engine for a participant's symbol, and who only relays.
 */
public enum ParticipantRole
{
    /** Local input drives a symbol on the peer that owns the engine. */
    LOCAL_AUTHORITATIVE,

    /** Local input drives a symbol whose moves are committed by the remote peer. */
    LOCAL_INPUT_SOURCE,

    /** The symbol is played on the remote peer, which also owns the engine. */
    REMOTE_AUTHORITATIVE,

    /** The symbol is played on the remote peer; its requests are relayed into the local engine. */
    REMOTE_INPUT_RELAY
}
