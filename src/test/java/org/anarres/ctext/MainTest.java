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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the command line against temporary files.
 */
public class MainTest {

    private static final String SOURCE = "/* header */\n"
            + "#define LOG(x) puts(x)\n"
            + "int main(void) {\n"
            + "    LOG(\"hi\"); // greet\n"
            + "    return 0;\n"
            + "}\n";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return run(stdin.getBytes(StandardCharsets.UTF_8), args);
    }

    private int run(byte[] stdin, String... args) {
        Main main = new Main(new ByteArrayInputStream(stdin),
                new PrintStream(out, true), new PrintStream(err, true));
        return main.run(args);
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    private File source() throws Exception {
        Path path = tempDir.resolve("main.c");
        Files.write(path, SOURCE.getBytes(StandardCharsets.UTF_8));
        return path.toFile();
    }

    @Test
    @Tag("unit")
    void testStripToStdout() throws Exception {
        assertThat(run("", "strip", source().getPath())).isZero();
        assertThat(stdout()).isEqualTo("\n"
                + "#define LOG(x) puts(x)\n"
                + "int main(void) {\n"
                + "    LOG(\"hi\"); \n"
                + "    return 0;\n"
                + "}\n");
    }

    @Test
    @Tag("unit")
    void testStripToFile() throws Exception {
        File output = tempDir.resolve("out/stripped.c").toFile();
        assertThat(run("", "strip", "--output", output.getPath(), source().getPath())).isZero();
        assertThat(new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8))
                .isEqualTo(CommentStripper.strip(SOURCE));
        assertThat(stdout()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testStripFromStdin() throws Exception {
        assertThat(run("a; // b\nc;", "strip")).isZero();
        assertThat(stdout()).isEqualTo("a; \nc;");
    }

    @Test
    @Tag("unit")
    void testStripPreservesBytes() throws Exception {
        byte[] input = {'x', ' ', (byte) 0xE9, ';', ' ', '/', '*', 'c', '*', '/', '\n'};
        assertThat(run(input, "strip")).isZero();
        assertThat(out.toByteArray()).isEqualTo(new byte[]{'x', ' ', (byte) 0xE9, ';', ' ', '\n'});

        out.reset();
        byte[] utf8 = "s = \"caf\u00e9\"; // \u00fcber\n".getBytes(StandardCharsets.UTF_8);
        assertThat(run(utf8, "strip")).isZero();
        assertThat(stdout()).isEqualTo("s = \"caf\u00e9\"; \n");
    }

    @Test
    @Tag("unit")
    void testTokens() throws Exception {
        File file = source();
        assertThat(run("", "tokens", file.getPath())).isZero();
        JsonArray tokens = JsonParser.parseString(stdout()).getAsJsonArray();
        assertThat(tokens.size()).isEqualTo(4);
        JsonObject first = tokens.get(0).getAsJsonObject();
        assertThat(first.get("type").getAsString()).isEqualTo("COMMENT");
        assertThat(first.get("filename").getAsString()).isEqualTo(file.getPath());
        assertThat(first.get("data").getAsString()).isEqualTo("/* header */");
        JsonObject comment = tokens.get(2).getAsJsonObject();
        assertThat(comment.get("line").getAsInt()).isEqualTo(4);
        assertThat(comment.get("column").getAsInt()).isEqualTo(16);
    }

    @Test
    @Tag("unit")
    void testInvocations() throws Exception {
        assertThat(run("", "invocations", "--name", "LOG", source().getPath())).isZero();
        assertThat(stdout()).isEqualTo("LOG( \"hi\" );\nstart=4, end=4\n");
    }

    @Test
    @Tag("unit")
    void testInvocationsAsJson() throws Exception {
        assertThat(run("", "invocations", "-n", "LOG", "--json", source().getPath())).isZero();
        JsonArray invocations = JsonParser.parseString(stdout()).getAsJsonArray();
        assertThat(invocations.size()).isEqualTo(1);
        JsonObject invocation = invocations.get(0).getAsJsonObject();
        assertThat(invocation.get("name").getAsString()).isEqualTo("LOG");
        assertThat(invocation.get("start").getAsInt()).isEqualTo(4);
        assertThat(invocation.getAsJsonArray("args").get(0).getAsString()).isEqualTo("\"hi\"");
    }

    @Test
    @Tag("unit")
    void testInvocationsFromStdin() throws Exception {
        assertThat(run("F(1);\nF(2, 3);\n", "invocations", "--name", "F")).isZero();
        assertThat(stdout()).isEqualTo("F( 1 );\nstart=1, end=1\nF( 2, 3 );\nstart=2, end=2\n");
    }

    @Test
    @Tag("unit")
    void testInvocationsBeforeAnErrorArePrinted() throws Exception {
        assertThat(run("F(1);\nF(2)\n", "invocations", "--name", "F")).isEqualTo(1);
        assertThat(stdout()).isEqualTo("F( 1 );\nstart=1, end=1\n");
        assertThat(stderr()).contains("macro function missing terminating semicolon");
    }

    @Test
    @Tag("unit")
    void testInvocationsRequireNames() throws Exception {
        assertThat(run("", "invocations", source().getPath())).isEqualTo(1);
        assertThat(stderr()).contains("--name");
    }

    @Test
    @Tag("unit")
    void testScanErrors() throws Exception {
        assertThat(run("int x; /* open", "strip")).isEqualTo(1);
        assertThat(stderr()).isEqualTo("ctext: <input>:1:8: unexpected end of multi-line comment"
                + System.lineSeparator());
    }

    @Test
    @Tag("unit")
    void testMaxTokenSize() throws Exception {
        assertThat(run("/* a rather long comment */", "--max-token-size", "4", "tokens")).isEqualTo(1);
        assertThat(stderr()).contains("token exceeds maximum size of 4 characters");
    }

    @Test
    @Tag("unit")
    void testUsage() throws Exception {
        assertThat(run("")).isEqualTo(1);
        assertThat(stderr()).contains("Usage: ctext command");

        err.reset();
        assertThat(run("", "frobnicate")).isEqualTo(1);
        assertThat(stderr()).contains("unknown command \"frobnicate\"");

        err.reset();
        assertThat(run("", "strip", "--bogus")).isEqualTo(1);
        assertThat(stderr()).contains("bogus");

        assertThat(run("", "--help")).isZero();
        assertThat(stdout()).contains("strip").contains("--max-token-size");
    }
}
