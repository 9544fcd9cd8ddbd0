/**
 * Default codec implementations: newline framing and Jackson JSON payloads.
 */
package com.questrail.tictactoe.protocol.codec.impl;
