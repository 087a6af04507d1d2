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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import java.util.regex.Matcher;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds invocations of function-like macros in C source.
 *
 * Only the text tokens of the underlying {@link Scanner} are examined, so
 * names within comments are never matched. Names within string literals,
 * and names following {@code #define}, {@code #undef}, {@code #ifdef} or
 * {@code #ifndef}, are not invocations either.
 *
 * An invocation may span several lines and may be interrupted by comments;
 * a comment within the argument list separates arguments as a space would.
 */
public class InvocationScanner {

    private static final Logger LOG = LoggerFactory.getLogger(InvocationScanner.class);

    private static final String[] DIRECTIVES = {"define", "undef", "ifdef", "ifndef"};

    private enum State {
        SEARCHING, AWAITING_PAREN, IN_ARGUMENTS
    }

    private final Scanner scanner;
    private final MacroNames names;
    private boolean scanned;

    private State state = State.SEARCHING;
    private int line;
    /* The last text token ended in a directive keyword, such as "#define ". */
    private boolean directivePending;

    /* Reset for every text token. */
    private boolean inStringLiteral;
    private boolean escaped;

    /* The invocation in progress. */
    private String name;
    private Position namePosition;
    private ArgumentParser parser;

    public InvocationScanner(@Nonnull Scanner scanner, @Nonnull MacroNames names) {
        if (scanner == null)
            throw new NullPointerException("Scanner was null.");
        if (names == null)
            throw new NullPointerException("Names were null.");
        this.scanner = scanner;
        this.names = names;
    }

    /**
     * Scans the given reader for invocations of the named macros.
     */
    public static void scan(@Nonnull Reader reader, @Nonnull InvocationListener listener, @Nonnull String... names)
            throws IOException,
            LexerException {
        new InvocationScanner(new Scanner(reader), new MacroNames(names)).scan(listener);
    }

    public static void scan(@Nonnull String source, @Nonnull InvocationListener listener, @Nonnull String... names)
            throws IOException,
            LexerException {
        scan(new StringReader(source), listener, names);
    }

    /**
     * Scans the whole input, passing each invocation to the listener as
     * soon as its terminating semicolon is read.
     *
     * An instance scans its input once.
     *
     * @throws LexerException if the input cannot be tokenized, or if a
     * macro name is not followed by an argument list ending in a semicolon.
     * Invocations passed to the listener before the error remain valid.
     */
    public void scan(@Nonnull InvocationListener listener)
            throws IOException,
            LexerException {
        if (scanned)
            throw new IllegalStateException("Input already scanned");
        scanned = true;
        for (;;) {
            switch (scanner.next()) {
                case EOF:
                    finish();
                    return;
                case COMMENT:
                    comment(scanner.getToken());
                    break;
                case TEXT:
                    text(scanner.getToken(), listener);
                    break;
            }
        }
    }

    /**
     * Scans the whole input, returning the invocations found.
     */
    @Nonnull
    public List<Invocation> scanAll()
            throws IOException,
            LexerException {
        InvocationCollector collector = new InvocationCollector();
        scan(collector);
        return collector.getInvocations();
    }

    private void finish() throws LexerException {
        switch (state) {
            case AWAITING_PAREN:
                throw new LexerException(namePosition, "macro function missing opening parentheses");
            case IN_ARGUMENTS:
                throw new LexerException(namePosition, "macro function missing terminating semicolon");
            default:
                break;
        }
    }

    private void comment(@Nonnull Token token) throws LexerException {
        // A comment is a space to the C lexer.
        if (state == State.IN_ARGUMENTS)
            parser.accept(' ');
        // A line comment ends the directive line.
        if (token.getText().startsWith("//"))
            directivePending = false;
    }

    private void text(@Nonnull Token token, @Nonnull InvocationListener listener) throws LexerException {
        String text = token.getText();
        line = token.getLine();
        inStringLiteral = false;
        escaped = false;
        boolean continuesDirective = directivePending;
        directivePending = false;

        int i = 0;
        while (i < text.length()) {
            switch (state) {
                case SEARCHING:
                    i = search(token, i, continuesDirective);
                    break;

                case AWAITING_PAREN: {
                    char c = text.charAt(i++);
                    if (c == '(') {
                        parser = new ArgumentParser();
                        state = State.IN_ARGUMENTS;
                    } else if (c == '\n') {
                        line++;
                    } else if (!Character.isWhitespace(c)) {
                        throw new LexerException(namePosition, "macro function missing opening parentheses");
                    }
                    break;
                }

                case IN_ARGUMENTS: {
                    char c = text.charAt(i++);
                    if (c == '\n')
                        line++;
                    if (parser.accept(c)) {
                        Invocation invocation = new Invocation(name, namePosition.getLine(), line, parser.getArgs());
                        LOG.debug("Found invocation " + invocation + " at " + namePosition);
                        state = State.SEARCHING;
                        parser = null;
                        listener.handleInvocation(invocation);
                    }
                    break;
                }
            }
        }
        if (state == State.SEARCHING)
            directivePending = isDirective(text, text.length())
                    || (continuesDirective && skipBlanksBackward(text, text.length() - 1) < 0);
    }

    /**
     * Looks for the next macro name in the token, from the given index.
     *
     * @param continuesDirective true if the token follows a directive
     * keyword and a block comment, which leaves the directive line open.
     * @return the index after the name if one was found, else the length of the text.
     */
    private int search(@Nonnull Token token, int from, boolean continuesDirective) {
        String text = token.getText();
        Matcher matcher = names.matcher(text);
        if (matcher == null) {
            advance(text, from, text.length());
            return text.length();
        }

        int i = from;
        while (matcher.find(i)) {
            advance(text, i, matcher.start());
            boolean quoted = inStringLiteral;
            advance(text, matcher.start(), matcher.end());
            i = matcher.end();

            if (quoted) {
                LOG.debug("Skipping " + matcher.group() + " in string literal at line " + line);
                continue;
            }
            if (isDirective(text, matcher.start())
                    || (continuesDirective && skipBlanksBackward(text, matcher.start() - 1) < 0)) {
                LOG.debug("Skipping directive for " + matcher.group() + " at line " + line);
                continue;
            }

            name = matcher.group();
            namePosition = positionOf(token, matcher.start());
            state = State.AWAITING_PAREN;
            return i;
        }

        advance(text, i, text.length());
        return text.length();
    }

    /** Tracks lines and string literals over text[from, to). */
    private void advance(@Nonnull String text, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c == '\n')
                line++;
            else if (c == '"' && !escaped)
                inStringLiteral = !inStringLiteral;
            escaped = c == '\\' && !escaped;
        }
    }

    /**
     * Returns true if the name at the given index follows a preprocessor
     * directive which names a macro without invoking it, such as
     * {@code #define NAME(x)} or {@code #  undef NAME}.
     */
    /* pp */ static boolean isDirective(@Nonnull String text, int index) {
        int i = skipBlanksBackward(text, index - 1);
        for (String directive : DIRECTIVES) {
            int begin = i - directive.length() + 1;
            if (begin >= 0 && text.startsWith(directive, begin)) {
                int j = skipBlanksBackward(text, begin - 1);
                return j >= 0 && text.charAt(j) == '#';
            }
        }
        return false;
    }

    private static int skipBlanksBackward(@Nonnull String text, int i) {
        while (i >= 0 && (text.charAt(i) == ' ' || text.charAt(i) == '\t'))
            i--;
        return i;
    }

    /* Offsets do not count the carriage returns dropped from the token. */
    @Nonnull
    private static Position positionOf(@Nonnull Token token, int index) {
        Position start = token.getPosition();
        String text = token.getText();
        int line = start.getLine();
        int column = start.getColumn();
        for (int i = 0; i < index; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new Position(start.getFilename(), start.getOffset() + index, line, column);
    }
}
