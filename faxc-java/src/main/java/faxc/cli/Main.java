package faxc.cli;

import faxc.ast.AstDocument;
import faxc.codegen.ProgramGenerator;
import faxc.diag.CodegenException;
import faxc.io.AstReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, utf8(FileDescriptor.out), utf8(FileDescriptor.err)));
    }

    /** Generated code is UTF-8 on every sink, whatever the platform charset. */
    private static PrintStream utf8(FileDescriptor fd) {
        return new PrintStream(new FileOutputStream(fd), true, StandardCharsets.UTF_8);
    }

    /** Exit status: 0 on success, 1 on a failed pass, 2 on a usage error. */
    static int run(String[] args, PrintStream stdout, PrintStream stderr) {
        if (args.length < 1 || args.length > 2) {
            stderr.println("Usage: faxc <ast.json> [output.cpp]");
            return USAGE;
        }
        Path input = Path.of(args[0]);
        Path output = args.length == 2 ? Path.of(args[1]) : null;

        try {
            // 1. Чтение и проверка дерева
            AstDocument document = AstReader.read(input);
            log.info("[1/2] Read: {} ({} declarations, {} statements)", input,
                    document.program().declarations().size(), document.program().statements().size());

            // 2. Генерация: текст целиком в памяти, наружу только после успеха
            String code = new ProgramGenerator().generate(document);
            log.info("[2/2] Generated: {} lines", code.lines().count());

            if (output == null) {
                stdout.print(code);
                stdout.flush();
            } else {
                Files.writeString(output, code, StandardCharsets.UTF_8);
                log.info("Wrote {}", output);
            }
            return OK;
        } catch (CodegenException e) {
            stderr.println(e.describe());
            return FAILED;
        } catch (IOException e) {
            stderr.println("error[io]: " + e.getMessage());
            return FAILED;
        }
    }
}
