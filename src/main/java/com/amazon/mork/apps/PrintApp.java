// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.apps;

import com.amazon.mork.MorkLoader;
import com.amazon.mork.MorkParseResult;
import com.amazon.mork.impl.MorkLexer;
import com.amazon.mork.system.MorkLoaderBuilder;
import com.amazon.mork.util.MorkTextPrinter;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints the tables of Mork files, or their tokens.  Files are handled one
 * at a time; a file that fails is reported on stderr and the rest are still
 * printed.
 */
@Command(
        name = PrintApp.NAME,
        version = PrintApp.VERSION,
        description = "Print the tables of Mork database FILE(s).",
        mixinStandardHelpOptions = true
)
public class PrintApp implements Callable<Integer> {

    public static final String NAME = "mork-print";
    public static final String VERSION = "1.0.0";

    private static final Logger LOG = Logger.getLogger(PrintApp.class.getName());

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new PrintApp())
                .setUsageHelpAutoWidth(true);
    }

    @Spec
    CommandSpec spec;

    @Parameters(paramLabel = "FILE", arity = "1..*", description = "Mork files to print")
    File[] files;

    @Option(names = "--tokens", description = "Print the token stream instead of the tables.")
    boolean tokens;

    @Option(names = "--raw-literals", description = "Print literal values as written, without decoding escapes.")
    boolean rawLiterals;

    @Option(names = "--lenient-groups", description = "Accept group commit markers whose id differs from the group's.")
    boolean lenientGroups;

    @Option(names = "--charset", paramLabel = "<name>", defaultValue = "UTF-8",
            description = "Charset of literal values (default: ${DEFAULT-VALUE}).")
    Charset charset;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        MorkLoader loader = MorkLoaderBuilder.standard()
                .withLiteralDecodingEnabled(!rawLiterals)
                .withGroupIdValidationEnabled(!lenientGroups)
                .withCharset(charset)
                .build();

        boolean allOk = true;
        for (File file : files) {
            if (!printFile(file, loader, out, err)) {
                allOk = false;
            }
        }
        out.flush();
        err.flush();
        return allOk ? CommandLine.ExitCode.OK : CommandLine.ExitCode.SOFTWARE;
    }

    private boolean printFile(File file, MorkLoader loader, PrintWriter out, PrintWriter err) {
        byte[] data;
        try {
            data = Files.readAllBytes(file.toPath());
        } catch (IOException e) {
            LOG.log(Level.WARNING, "cannot read " + file, e);
            err.println("ERROR: " + file + ": cannot read file: " + e.getMessage());
            return false;
        }

        try {
            if (tokens) {
                if (!MorkTextPrinter.printTokens(new MorkLexer(data), out)) {
                    err.println("ERROR: " + file + ": token stream ended with an error");
                    return false;
                }
                return true;
            }
            MorkParseResult result = loader.load(file.getPath(), data);
            MorkTextPrinter.print(result.getTables(), out);
            if (!result.isSuccess()) {
                err.println("ERROR: " + result.getError().getMessage());
                return false;
            }
            return true;
        } catch (IOException e) {
            // PrintWriter never throws; Appendable declares it anyway
            throw new IllegalStateException(e);
        }
    }
}
