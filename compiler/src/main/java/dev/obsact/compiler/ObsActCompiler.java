package dev.obsact.compiler;

import dev.obsact.compiler.codegen.GeneratorConfig;
import dev.obsact.compiler.codegen.PythonGenerator;
import dev.obsact.compiler.lexer.Tokenization;
import dev.obsact.compiler.lexer.Tokenizer;
import dev.obsact.compiler.parser.ParseResult;
import dev.obsact.compiler.parser.ProgramParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point for the ObsAct-to-Python compiler. Wires the tokenizer, the ANTLR4 parser with
 * its recovering error strategy and the Python generator together.
 * <p>
 * Every {@link #compile(String)} call scans, parses and generates with fresh objects, so one
 * compiler may serve any number of compiles, from any number of threads.
 */
public final class ObsActCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ObsActCompiler.class);

    private final GeneratorConfig config;

    public ObsActCompiler() {
        this(GeneratorConfig.defaults());
    }

    public ObsActCompiler(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public CompilationResult compile(String source) {
        Objects.requireNonNull(source, "source");
        logger.debug("Compiling {} characters", source.length());

        Tokenization tokens = Tokenizer.tokenize(source);
        ParseResult parsed = ProgramParser.parse(tokens);
        if (!parsed.succeeded()) {
            logger.info("Compilation failed with {} error(s)", parsed.errors().size());
            return CompilationResult.failure(parsed.errors());
        }
        for (CompileError error : parsed.errors()) {
            logger.warn("{}", error.format());
        }

        String code = new PythonGenerator(config).generate(parsed.requireProgram());
        logger.debug("Generated {} characters", code.length());
        return CompilationResult.success(code, parsed.errors());
    }

    /**
     * Compiles {@code source} and returns the generated program.
     *
     * @throws CompilationException carrying every diagnostic when the source does not compile
     */
    public String compileOrThrow(String source) throws CompilationException {
        CompilationResult result = compile(source);
        if (!result.succeeded()) {
            throw new CompilationException(result.errors());
        }
        return result.output();
    }

    public static void main(String[] args) throws IOException {
        int status = run(args, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Compiles {@code args[0]} into {@code args[1]}, printing diagnostics to {@code err}.
     *
     * @return 0 on success, 1 when the source does not compile, 2 on bad usage
     */
    static int run(String[] args, PrintStream err) throws IOException {
        if (args.length != 2) {
            err.println("usage: ObsActCompiler <source.obs> <output.py>");
            return 2;
        }

        Path source = Path.of(args[0]);
        Path target = Path.of(args[1]);

        ObsActCompiler compiler = new ObsActCompiler(GeneratorConfig.fromEnvironment());
        CompilationResult result = compiler.compile(Files.readString(source, StandardCharsets.UTF_8));
        for (CompileError error : result.errors()) {
            err.println(source.getFileName() + ": " + error.format());
        }
        if (!result.succeeded()) {
            return 1;
        }

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, result.output(), StandardCharsets.UTF_8);
        logger.info("Wrote {}", target);
        return 0;
    }
}
