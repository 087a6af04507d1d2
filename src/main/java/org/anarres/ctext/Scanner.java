/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.ctext;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits C source into comment and text tokens.
 *
 * The scanner reads its input lazily, one character at a time, and holds
 * at most one token in memory. Concatenating the text of every token
 * returned reproduces the input without its carriage returns.
 *
 * <pre>
 * Scanner s = new Scanner(reader, "hello.c");
 * for (TokenType tt = s.next(); tt != TokenType.EOF; tt = s.next()) {
 *     Token token = s.getToken();
 *     ...
 * }
 * </pre>
 *
 * A Scanner is not thread safe.
 */
public class Scanner implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Scanner.class);

    private static final int EOF = -1;

    private final Reader reader;
    private final String filename;

    /* Lookahead. */
    private final int[] ahead = new int[2];
    private int aheadCount;

    /* The cursor: where the next character comes from. */
    private int offset;
    private int line;
    private int column;

    /* The current token. */
    private final TextBuffer buf;
    private TokenType type;
    private Position start;

    /* Reset by every call to next(). */
    private boolean inStringLiteral;
    private int multiLineCommentDepth;
    private boolean inSingleLineComment;

    /* Terminal conditions. */
    private boolean eof;
    private IOException ioError;
    private LexerException lexerError;

    public Scanner(@Nonnull Reader reader, @Nonnull String filename) {
        if (reader == null)
            throw new NullPointerException("Reader was null.");
        if (filename == null)
            throw new NullPointerException("Filename was null.");
        this.reader = reader;
        this.filename = filename;
        this.line = 1;
        this.column = 1;
        this.buf = new TextBuffer();
        this.start = Position.NONE;
    }

    public Scanner(@Nonnull Reader reader) {
        this(reader, "");
    }

    /**
     * Creates a scanner reading the given stream as ISO-8859-1, one
     * character per byte, so no input is rejected or altered and positions
     * count bytes. Write the tokens back as ISO-8859-1 to reproduce the
     * input bytes.
     */
    public Scanner(@Nonnull InputStream in, @Nonnull String filename) {
        this(new BufferedReader(new InputStreamReader(in, StandardCharsets.ISO_8859_1)), filename);
    }

    public Scanner(@Nonnull String source) {
        this(new StringReader(source), "");
    }

    @Nonnull
    public String getFilename() {
        return filename;
    }

    /**
     * Sets the maximum number of characters in a single token.
     * Zero, the default, means unlimited.
     */
    public void setMaxTokenSize(@Nonnegative int maxTokenSize) {
        buf.setMaxLength(maxTokenSize);
    }

    public int getMaxTokenSize() {
        return buf.getMaxLength();
    }

    /**
     * Advances to the next token.
     *
     * @return {@link TokenType#COMMENT} or {@link TokenType#TEXT} if a token
     * is available from {@link #getToken()}, or {@link TokenType#EOF} once
     * the input is exhausted. EOF is returned again by every later call.
     * @throws IOException if the underlying reader fails.
     * @throws LexerException if the input is malformed. Every later call
     * throws the same exception.
     */
    @Nonnull
    public TokenType next() throws IOException, LexerException {
        if (ioError != null)
            throw ioError;
        if (lexerError != null)
            throw lexerError;
        if (eof)
            return TokenType.EOF;
        try {
            type = _next();
        } catch (IOException e) {
            type = null;
            ioError = e;
            throw e;
        } catch (LexerException e) {
            type = null;
            lexerError = e;
            throw e;
        }
        if (type == TokenType.EOF) {
            eof = true;
            LOG.debug("Reached end of " + getCursor());
        } else if (LOG.isDebugEnabled()) {
            LOG.debug("Returning " + getToken());
        }
        return type;
    }

    @Nonnull
    private TokenType _next() throws IOException, LexerException {
        buf.clear();
        inStringLiteral = false;
        multiLineCommentDepth = 0;
        inSingleLineComment = false;
        start = null;

        for (;;) {
            int c = peek(0);
            if (c == EOF) {
                if (multiLineCommentDepth > 0)
                    throw new LexerException(start, "unexpected end of multi-line comment");
                // An unterminated line comment is flushed as text.
                if (!buf.isEmpty())
                    return TokenType.TEXT;
                start = getCursor();
                return TokenType.EOF;
            }

            if (c == '\r') {
                // Dropped, the \n which follows ends the line.
                skip();
                continue;
            }

            if (start == null)
                start = getCursor();

            if (inSingleLineComment) {
                consume();
                if (c == '\n')
                    return TokenType.COMMENT;
            } else if (multiLineCommentDepth > 0) {
                // The opening "/*" must not also serve as the closing "*/".
                boolean close = c == '/' && buf.lastChar() == '*' && buf.length() > 2;
                consume();
                if (close) {
                    multiLineCommentDepth--;
                    return TokenType.COMMENT;
                }
            } else if (inStringLiteral) {
                if (c == '"' && !buf.isEscaping())
                    inStringLiteral = false;
                consume();
            } else if (c == '/' && isCommentStart(peek(1))) {
                if (!buf.isEmpty())
                    return TokenType.TEXT;
                if (peek(1) == '/')
                    inSingleLineComment = true;
                else
                    multiLineCommentDepth = 1;
                consume();
                consume();
            } else {
                if (c == '"' && !buf.isEscaping())
                    inStringLiteral = true;
                consume();
            }
        }
    }

    private static boolean isCommentStart(int c) {
        return c == '/' || c == '*';
    }

    private int peek(int n) throws IOException {
        while (aheadCount <= n)
            ahead[aheadCount++] = reader.read();
        return ahead[n];
    }

    /** Consumes the next character without buffering it. */
    private int skip() throws IOException {
        int c = peek(0);
        ahead[0] = ahead[1];
        aheadCount--;
        if (c != EOF)
            offset++;
        return c;
    }

    /** Consumes the next character into the current token. */
    private void consume() throws IOException, LexerException {
        int c = skip();
        buf.append((char) c);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    /**
     * Returns the type of the current token, or null if {@link #next()}
     * has not returned one.
     */
    @CheckForNull
    public TokenType getType() {
        return type;
    }

    /**
     * Returns the current token.
     *
     * @throws IllegalStateException if {@link #next()} has not returned a token.
     */
    @Nonnull
    public Token getToken() {
        if (type == null)
            throw new IllegalStateException("No current token");
        return new Token(type, start, buf.toString());
    }

    /**
     * Returns the text of the current token, or the empty string if there is none.
     */
    @Nonnull
    public String getText() {
        return buf.toString();
    }

    /** Returns the position of the first character of the current token. */
    @Nonnull
    public Position getPosition() {
        return start == null ? Position.NONE : start;
    }

    /** Returns the position of the next character to be read. */
    @Nonnull
    public Position getCursor() {
        return new Position(filename, offset, line, column);
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    @Override
    public String toString() {
        return "Scanner(" + getCursor() + ")";
    }
}
