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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nonnull;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line front end.
 *
 * <pre>
 * ctext strip [--output file] [file]
 * ctext tokens [file]
 * ctext invocations --name NAME... [--json] [file...]
 * </pre>
 *
 * Files default to standard input.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = "Usage: ctext command [options] [file...]\n"
            + "\n"
            + "Available commands:\n"
            + "\n"
            + "    strip           strip comments from a C source file\n"
            + "    tokens          print the comment and text tokens of a C source file as JSON\n"
            + "    invocations     print the invocations of the named function-like macros\n"
            + "\n";

    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    private final OptionParser parser = new OptionParser();
    private final OptionSpec<?> helpOption = parser.accepts("help",
            "Displays command-line help.")
            .forHelp();
    private final OptionSpec<File> outputOption = parser.acceptsAll(Arrays.asList("output", "o"),
            "Writes stripped source to the given file instead of stdout.")
            .withRequiredArg().ofType(File.class).describedAs("file");
    private final OptionSpec<String> nameOption = parser.acceptsAll(Arrays.asList("name", "n"),
            "Looks for invocations of the named macro. May be repeated.")
            .withRequiredArg().ofType(String.class).describedAs("macro");
    private final OptionSpec<Void> jsonOption = parser.accepts("json",
            "Prints invocations as JSON.");
    private final OptionSpec<Integer> maxTokenSizeOption = parser.accepts("max-token-size",
            "Fails on any comment or text token longer than this many characters. 0 means unlimited.")
            .withRequiredArg().ofType(Integer.class).describedAs("chars").defaultsTo(0);
    private final OptionSpec<String> argumentsOption = parser.nonOptions()
            .ofType(String.class).describedAs("command followed by the files to process");

    public Main(@Nonnull InputStream stdin, @Nonnull PrintStream stdout, @Nonnull PrintStream stderr) {
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public static void main(String[] args) {
        int status = new Main(System.in, System.out, System.err).run(args);
        if (status != 0)
            System.exit(status);
    }

    /**
     * Runs the command line.
     *
     * @return the process exit status.
     */
    public int run(@Nonnull String[] args) {
        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            stderr.println("ctext: " + e.getMessage());
            return usage();
        }

        List<String> arguments = new ArrayList<String>(options.valuesOf(argumentsOption));
        if (options.has(helpOption)) {
            stdout.print(USAGE);
            try {
                parser.printHelpOn(stdout);
            } catch (IOException e) {
                LOG.error("Failed to print help", e);
                return 1;
            }
            return 0;
        }
        if (arguments.isEmpty())
            return usage();

        String command = arguments.remove(0);
        List<File> files = new ArrayList<File>();
        for (String argument : arguments)
            files.add(new File(argument));
        int maxTokenSize = options.valueOf(maxTokenSizeOption);
        if (maxTokenSize < 0) {
            stderr.println("ctext: --max-token-size must not be negative");
            return usage();
        }

        try {
            switch (command) {
                case "strip":
                    if (files.size() > 1) {
                        stderr.println("ctext: Expected a single input file.");
                        return 1;
                    }
                    strip(files, options.valueOf(outputOption), maxTokenSize);
                    return 0;
                case "tokens":
                    if (files.size() > 1) {
                        stderr.println("ctext: Expected a single input file.");
                        return 1;
                    }
                    tokens(files, maxTokenSize);
                    return 0;
                case "invocations":
                    List<String> names = options.valuesOf(nameOption);
                    if (names.isEmpty()) {
                        stderr.println("ctext: invocations requires at least one --name");
                        return 1;
                    }
                    invocations(files, new MacroNames(names), options.has(jsonOption), maxTokenSize);
                    return 0;
                default:
                    stderr.println("ctext: unknown command \"" + command + "\"");
                    stderr.println("Run 'ctext --help' for usage.");
                    return 1;
            }
        } catch (LexerException e) {
            LOG.debug("Failed to scan", e);
            stderr.println("ctext: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.debug("I/O error", e);
            stderr.println("ctext: " + e);
            return 1;
        }
    }

    private int usage() {
        stderr.print(USAGE);
        stderr.println("Run 'ctext --help' for options.");
        return 1;
    }

    @Nonnull
    private Scanner open(@Nonnull List<File> files, int index, int maxTokenSize) throws IOException {
        Scanner scanner;
        if (files.isEmpty())
            scanner = new Scanner(stdin, "");
        else
            scanner = new Scanner(FileUtils.openInputStream(files.get(index)), files.get(index).getPath());
        scanner.setMaxTokenSize(maxTokenSize);
        return scanner;
    }

    /* Input is read as ISO-8859-1, so writing it back the same way reproduces its bytes. */
    @Nonnull
    private static Writer writer(@Nonnull OutputStream out) {
        return IOUtils.buffer(new OutputStreamWriter(out, StandardCharsets.ISO_8859_1));
    }

    private void strip(@Nonnull List<File> files, File output, int maxTokenSize)
            throws IOException,
            LexerException {
        try (Scanner scanner = open(files, 0, maxTokenSize)) {
            if (output == null) {
                int comments = CommentStripper.strip(scanner, writer(stdout));
                LOG.debug("Stripped " + comments + " comments");
            } else {
                try (Writer out = writer(FileUtils.openOutputStream(output))) {
                    int comments = CommentStripper.strip(scanner, out);
                    LOG.debug("Stripped " + comments + " comments into " + output);
                }
            }
        }
    }

    private void tokens(@Nonnull List<File> files, int maxTokenSize)
            throws IOException,
            LexerException {
        JsonArray tokens = new JsonArray();
        try (Scanner scanner = open(files, 0, maxTokenSize)) {
            for (TokenType tt = scanner.next(); tt != TokenType.EOF; tt = scanner.next())
                tokens.add(scanner.getToken().toJson());
        }
        print(tokens);
    }

    private void print(@Nonnull JsonArray array) throws IOException {
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        Writer out = writer(stdout);
        gson.toJson(array, out);
        out.write('\n');
        out.flush();
    }

    private void invocations(@Nonnull List<File> files, @Nonnull MacroNames names, boolean json, int maxTokenSize)
            throws IOException,
            LexerException {
        JsonArray result = new JsonArray();
        Writer out = writer(stdout);
        int count = Math.max(files.size(), 1);
        for (int i = 0; i < count; i++) {
            InvocationCollector collector = new InvocationCollector();
            try (Scanner scanner = open(files, i, maxTokenSize)) {
                new InvocationScanner(scanner, names).scan(collector);
            } finally {
                // Invocations found before an error are still reported.
                for (Invocation invocation : collector.getInvocations()) {
                    if (json) {
                        result.add(invocation.toJson());
                    } else {
                        out.write(invocation + "\n");
                        out.write("start=" + invocation.getStartLine() + ", end=" + invocation.getEndLine() + "\n");
                    }
                }
                out.flush();
            }
        }
        if (json)
            print(result);
    }
}
