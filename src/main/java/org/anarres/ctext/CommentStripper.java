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
import java.io.StringWriter;
import java.io.Writer;
import javax.annotation.Nonnull;

/**
 * Removes the comments from C source, leaving everything else untouched.
 *
 * The line breaks within a comment are kept, so the stripped source has
 * the same line numbers as the original. Text which preceded a comment on
 * the same line, including trailing spaces, is kept. Stripping is idempotent.
 */
public class CommentStripper {

    private CommentStripper() {
    }

    /**
     * Copies every text token, and the line breaks of every comment, from
     * the scanner to the writer.
     *
     * @return the number of comments removed.
     */
    public static int strip(@Nonnull Scanner scanner, @Nonnull Writer out)
            throws IOException,
            LexerException {
        int comments = 0;
        for (;;) {
            switch (scanner.next()) {
                case EOF:
                    out.flush();
                    return comments;
                case COMMENT:
                    comments++;
                    writeLineBreaks(scanner.getText(), out);
                    break;
                case TEXT:
                    out.write(scanner.getText());
                    break;
            }
        }
    }

    private static void writeLineBreaks(@Nonnull String comment, @Nonnull Writer out) throws IOException {
        for (int i = 0; i < comment.length(); i++) {
            if (comment.charAt(i) == '\n')
                out.write('\n');
        }
    }

    public static int strip(@Nonnull Reader in, @Nonnull Writer out)
            throws IOException,
            LexerException {
        return strip(new Scanner(in), out);
    }

    @Nonnull
    public static String strip(@Nonnull String source)
            throws LexerException {
        StringWriter out = new StringWriter();
        try {
            strip(new StringReader(source), out);
        } catch (IOException e) {
            throw new IllegalStateException("I/O error from a string", e);
        }
        return out.toString();
    }
}
