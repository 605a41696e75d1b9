// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import static com.amazon.mork.impl.MorkTokenConsts.EOF;
import static com.amazon.mork.impl.MorkTokenConsts.printByte;

import com.amazon.mork.SourcePosition;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;

/**
 * Tokenizer for Mork text.  This reads bytes from a complete in-memory
 * buffer and returns the tokens it recognizes, one per call to
 * {@link #nextToken()}, or a single {@link MorkTokenType#ERROR} token
 * describing why it could not go on.
 * <p>
 * The scanner is a small state machine.  Each state handler consumes input
 * from the current position, queues zero or more tokens and names the state
 * to run next; {@code nextToken()} runs handlers until a token is queued.
 * Nothing is scanned ahead of the caller, so a parser that stops early
 * never pays for the rest of the buffer.
 * <p>
 * Once an {@link MorkTokenType#EOF} or {@link MorkTokenType#ERROR} token
 * has been returned, every later call returns that same token.
 * <p>
 * The scanner is purely lexical: it does not know which tokens are legal
 * where, and it never decodes escapes inside literals.
 */
public final class MorkLexer
{
    private enum State {
        DEFAULT,
        NAME,
        LITERAL,
        COMMENT,
        GROUP,
        DONE
    }

    private final byte[]  _input;
    private final int     _limit;

    private int           _offset;
    private int           _line = 1;
    private int           _column;

    /** where the token being scanned started */
    private int           _start_offset;
    private int           _start_line = 1;
    private int           _start_column;

    private State         _state = State.DEFAULT;
    /** a state can emit two tokens at once, "^" + id and "=" + literal */
    private final ArrayDeque<MorkToken> _pending = new ArrayDeque<MorkToken>(2);
    private MorkToken     _terminal;


    /**
     * @param input the complete source; it is read but never modified.
     */
    public MorkLexer(byte[] input) {
        if (input == null) throw new NullPointerException("input");
        _input = input;
        _limit = input.length;
    }

    /**
     * Scans and returns the next token.
     *
     * @return never null; {@link MorkTokenType#EOF} at the end of the input.
     */
    public MorkToken nextToken() {
        while (_pending.isEmpty()) {
            if (_terminal != null) {
                return _terminal;
            }
            _state = run(_state);
        }
        return _pending.removeFirst();
    }

    /**
     * @return the position of the next unscanned byte.
     */
    public SourcePosition getPosition() {
        return new SourcePosition(_offset, _line, _column);
    }

    private State run(State state) {
        switch (state) {
        case DEFAULT: return lex_default();
        case NAME:    return lex_name();
        case LITERAL: return lex_literal();
        case COMMENT: return lex_comment();
        case GROUP:   return lex_group();
        case DONE:
            // only reachable if a state forgot to emit its terminal token
            throw new IllegalStateException("scanner finished without a terminal token");
        default:
            throw new IllegalStateException("unknown scanner state " + state);
        }
    }

    //
    //  character routines to fetch bytes and
    //  handle look ahead and line counting
    //
    private int peek_char() {
        if (_offset >= _limit) return EOF;
        return _input[_offset] & 0xff;
    }

    private int read_char() {
        if (_offset >= _limit) return EOF;
        int c = _input[_offset++] & 0xff;
        if (c == '\n') {
            _line++;
            _column = 0;
        }
        else {
            _column++;
        }
        return c;
    }

    private void mark_start() {
        _start_offset = _offset;
        _start_line = _line;
        _start_column = _column;
    }

    private void emit(MorkTokenType type) {
        String text = new String(_input, _start_offset, _offset - _start_offset,
                                 StandardCharsets.ISO_8859_1);
        SourcePosition pos = new SourcePosition(_start_offset, _start_line, _start_column);
        MorkToken token = new MorkToken(type, text, pos);
        _pending.addLast(token);
        if (type == MorkTokenType.EOF) {
            _terminal = token;
        }
        mark_start();
    }

    /**
     * Queues an error token positioned where scanning stopped and ends the
     * scan.
     */
    private State error(String message) {
        MorkToken token = new MorkToken(MorkTokenType.ERROR, message, getPosition());
        _pending.addLast(token);
        _terminal = token;
        return State.DONE;
    }

    private State bad_token_start(int c) {
        return error("bad character [" + printByte(c)
                     + "] encountered where a token was supposed to start");
    }

    //
    //  the states
    //
    private State lex_default() {
        for (;;) {
            int c = peek_char();
            if (c == EOF) {
                emit(MorkTokenType.EOF);
                return State.DONE;
            }
            if (MorkTokenConsts.isWhitespace(c)) {
                read_char();
                mark_start();
                continue;
            }
            MorkTokenType single = MorkTokenConsts.singleCharToken(c);
            if (single != null) {
                read_char();
                emit(single);
                return State.DEFAULT;
            }
            switch (c) {
            case '^':
                read_char();
                emit(MorkTokenType.CARET);
                if (skip_hex_digits() == 0) {
                    return error("expected a hex id after '^' but found "
                                 + printByte(peek_char()));
                }
                emit(MorkTokenType.NAME);
                return State.DEFAULT;
            case '/':
                return State.COMMENT;
            case '=':
                return State.LITERAL;
            case '@':
                return State.GROUP;
            default:
                if (MorkTokenConsts.isNameStart(c)) {
                    return State.NAME;
                }
                return bad_token_start(c);
            }
        }
    }

    /** letters, digits and '_', plus "-!?+" after the first character */
    private State lex_name() {
        read_char();
        while (MorkTokenConsts.isNamePart(peek_char())) {
            read_char();
        }
        emit(MorkTokenType.NAME);
        return State.DEFAULT;
    }

    /**
     * Emits the '=' by itself, then everything up to an unescaped ')' or the
     * end of input as the literal.  Backslashes are tracked only to find the
     * end; they are left in the token text.
     */
    private State lex_literal() {
        int c = read_char();
        if (c != '=') {
            return error("expected '=' but found " + printByte(c));
        }
        emit(MorkTokenType.EQUAL);

        boolean escaped = false;
        for (;;) {
            c = peek_char();
            if (c == EOF) break;
            if (!escaped && c == ')') break;
            escaped = !escaped && c == MorkTokenConsts.ESCAPE_CHAR;
            read_char();
        }
        emit(MorkTokenType.LITERAL);
        return State.DEFAULT;
    }

    /** "//" to the end of the line; the line feed itself is left as whitespace */
    private State lex_comment() {
        if (!expect("//")) {
            return State.DONE;
        }
        for (;;) {
            int c = peek_char();
            if (c == EOF || c == '\n') break;
            read_char();
        }
        mark_start();
        return State.DEFAULT;
    }

    /**
     * Group markers:
     * <pre>
     *   &#64;$${id{&#64;    start
     *   &#64;$$}id}&#64;    commit
     *   &#64;$$}~~}&#64;    abort
     * </pre>
     */
    private State lex_group() {
        if (!expect(MorkTokenConsts.GROUP_MARKER)) {
            return State.DONE;
        }
        int c = read_char();
        switch (c) {
        case '{':
            if (skip_hex_digits() == 0) {
                return error("expected a group id but found " + printByte(peek_char()));
            }
            if (!expect(MorkTokenConsts.GROUP_START_TERMINATOR)) {
                return State.DONE;
            }
            emit(MorkTokenType.GROUP_START);
            return State.DEFAULT;
        case '}':
            if (peek_char() == '~') {
                if (!expect(MorkTokenConsts.GROUP_ABORT_SUFFIX)) {
                    return State.DONE;
                }
                emit(MorkTokenType.GROUP_ABORT);
                return State.DEFAULT;
            }
            if (skip_hex_digits() == 0) {
                return error("expected a group id but found " + printByte(peek_char()));
            }
            if (!expect(MorkTokenConsts.GROUP_END_TERMINATOR)) {
                return State.DONE;
            }
            emit(MorkTokenType.GROUP_COMMIT);
            return State.DEFAULT;
        default:
            return error("expected '{' or '}' after \"" + MorkTokenConsts.GROUP_MARKER
                         + "\" but found " + printByte(c));
        }
    }

    /**
     * Consumes the given characters, queueing an error token at the first
     * one that does not match.
     *
     * @return false if an error was queued.
     */
    private boolean expect(String expected) {
        for (int ii = 0; ii < expected.length(); ii++) {
            int c = read_char();
            if (c != expected.charAt(ii)) {
                error("expected \"" + expected + "\" but found " + printByte(c));
                return false;
            }
        }
        return true;
    }

    private int skip_hex_digits() {
        int count = 0;
        while (MorkTokenConsts.isHexDigit(peek_char())) {
            read_char();
            count++;
        }
        return count;
    }
}
