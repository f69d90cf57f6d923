package com.github.musiKk.minic;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.log4j.Logger;

import com.github.musiKk.minic.codegen.CodeGenerator;
import com.github.musiKk.minic.parser.CompilationUnit;
import com.github.musiKk.minic.parser.Parser;
import com.github.musiKk.minic.parser.SyntaxException;
import com.github.musiKk.minic.parser.TreePrinter;
import com.github.musiKk.minic.semantic.SemanticAnalyzer;

import lombok.Setter;

/**
 * Runs the whole pipeline on one source text and, from the command line, on
 * source files.
 * <p>
 * Usage: {@code Compiler [--tree] FILE...}. Each file is compiled on its own;
 * a successful compilation is written to {@code <target>/<name>.il}. The exit
 * status is 0 on success, 1 if a file could not be read or parsed and 2 if a
 * file has diagnostics.
 */
public class Compiler implements ConfigReader.ConfigTarget {

    private static final Logger log = Logger.getLogger(Compiler.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_DIAGNOSTICS = 2;

    @Setter
    private List<String> lookupPath = new ArrayList<>(List.of("."));
    @Setter
    private String target = "target/il";
    @Setter
    private String assemblyName = CodeGenerator.DEFAULT_ASSEMBLY_NAME;

    public static void main(String... args) {
        var compiler = new Compiler();
        ConfigReader.readConfig().applyConfig(compiler);
        System.exit(compiler.run(args));
    }

    int run(String... args) {
        boolean printTree = false;
        List<String> files = new ArrayList<>();
        for (var arg : args) {
            if (arg.equals("--tree")) {
                printTree = true;
            } else {
                files.add(arg);
            }
        }
        if (files.isEmpty()) {
            System.err.println("usage: Compiler [--tree] FILE...");
            return EXIT_FAILURE;
        }
        int status = EXIT_OK;
        for (var file : files) {
            status = Math.max(status, compileFile(file, printTree));
        }
        return status;
    }

    /**
     * Lexes, parses and analyzes a program and generates code if no
     * diagnostics were found.
     *
     * @throws SyntaxException if the program does not match the grammar
     */
    public CompilationResult compile(String source) {
        var tokens = new Tokenizer().tokenize(source);
        var compilationUnit = new Parser().parseCompilationUnit(tokens);
        var semanticDiagnostics = new SemanticAnalyzer().analyze(compilationUnit);

        Optional<String> code = Optional.empty();
        if (tokens.diagnostics().isEmpty() && semanticDiagnostics.isEmpty()) {
            code = Optional.of(new CodeGenerator(assemblyName).generate(compilationUnit));
        }
        var result = new CompilationResult(tokens.diagnostics(), compilationUnit, semanticDiagnostics, code);
        log.info(String.format("%d function(s), %d diagnostic(s), %d line(s) of code",
                compilationUnit.functions().size(),
                result.diagnostics().size(),
                code.map(c -> c.lines().count()).orElse(0L)));
        return result;
    }

    int compileFile(String pathString, boolean printTree) {
        CompilationResult result;
        Path source;
        try {
            source = resolvePath(pathString);
            result = compile(Files.readString(source));
        } catch (SyntaxException e) {
            System.err.println(pathString + ": syntax error, " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | UncheckedIOException e) {
            System.err.println(pathString + ": cannot read file: " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (printTree) {
            System.out.println(TreePrinter.render(result.compilationUnit()));
        }
        if (!result.successful()) {
            result.diagnostics().forEach(d -> System.err.println(pathString + ": " + d));
            return EXIT_DIAGNOSTICS;
        }

        var output = Path.of(target, stem(source) + ".il");
        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
            Files.writeString(output, result.code().get());
        } catch (IOException e) {
            System.err.println(output + ": cannot write file: " + e.getMessage());
            return EXIT_FAILURE;
        }
        System.out.println(pathString + ": ok, written to " + output);
        return EXIT_OK;
    }

    private Path resolvePath(String pathString) throws NoSuchFileException {
        Path resolvedPath = Path.of(pathString);
        if (!resolvedPath.isAbsolute()) {
            var candidates = lookupPath.stream()
                    .map(p -> Path.of(p, pathString))
                    .filter(Files::exists)
                    .findFirst();
            if (candidates.isEmpty()) {
                throw new NoSuchFileException(pathString);
            }
            resolvedPath = candidates.get();
        }
        return resolvedPath;
    }

    private static String stem(Path path) {
        var name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Everything one compilation produced. Code is present only if there were
     * no diagnostics of any kind.
     */
    public record CompilationResult(List<Diagnostic> lexicalDiagnostics, CompilationUnit compilationUnit,
            List<Diagnostic> semanticDiagnostics, Optional<String> code) {

        public List<Diagnostic> diagnostics() {
            List<Diagnostic> all = new ArrayList<>(lexicalDiagnostics);
            all.addAll(semanticDiagnostics);
            return all;
        }

        public boolean successful() {
            return code.isPresent();
        }
    }
}
