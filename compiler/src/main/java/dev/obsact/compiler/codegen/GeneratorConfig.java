package dev.obsact.compiler.codegen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Settings of the generated program.
 * <p>
 * Every setting can be overridden from the environment:
 * <pre>
 * OBSACT_RUNTIME_MODULE=devices.runtime   module the four runtime functions are imported from
 * OBSACT_INDENT_WIDTH=2                   spaces per indentation level (1-8)
 * OBSACT_ENTRY_POINT=run                  name of the generated entry-point function
 * </pre>
 */
public final class GeneratorConfig {

    private static final Logger logger = LoggerFactory.getLogger(GeneratorConfig.class);

    static final String ENV_RUNTIME_MODULE = "OBSACT_RUNTIME_MODULE";
    static final String ENV_INDENT_WIDTH = "OBSACT_INDENT_WIDTH";
    static final String ENV_ENTRY_POINT = "OBSACT_ENTRY_POINT";

    public static final String DEFAULT_RUNTIME_MODULE = "functions";
    public static final int DEFAULT_INDENT_WIDTH = 4;
    public static final String DEFAULT_ENTRY_POINT = "main";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern MODULE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final String runtimeModule;
    private final int indentWidth;
    private final String entryPoint;

    private GeneratorConfig(Builder builder) {
        this.runtimeModule = builder.runtimeModule;
        this.indentWidth = builder.indentWidth;
        this.entryPoint = builder.entryPoint;
    }

    public static GeneratorConfig defaults() {
        return builder().build();
    }

    public static GeneratorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Applies the {@code OBSACT_*} overrides found in {@code env}; an invalid value is logged
     * and replaced by the default.
     */
    public static GeneratorConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();

        String module = env.get(ENV_RUNTIME_MODULE);
        if (module != null) {
            if (MODULE.matcher(module).matches()) {
                builder.runtimeModule(module);
            } else {
                logger.warn("Ignoring {}='{}': not a module name, using '{}'",
                        ENV_RUNTIME_MODULE, module, DEFAULT_RUNTIME_MODULE);
            }
        }

        String indent = env.get(ENV_INDENT_WIDTH);
        if (indent != null) {
            try {
                builder.indentWidth(Integer.parseInt(indent.trim()));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring {}='{}': {}, using {}",
                        ENV_INDENT_WIDTH, indent, e.getMessage(), DEFAULT_INDENT_WIDTH);
            }
        }

        String entryPoint = env.get(ENV_ENTRY_POINT);
        if (entryPoint != null) {
            if (IDENTIFIER.matcher(entryPoint).matches()) {
                builder.entryPoint(entryPoint);
            } else {
                logger.warn("Ignoring {}='{}': not an identifier, using '{}'",
                        ENV_ENTRY_POINT, entryPoint, DEFAULT_ENTRY_POINT);
            }
        }

        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String runtimeModule() {
        return runtimeModule;
    }

    public int indentWidth() {
        return indentWidth;
    }

    public String entryPoint() {
        return entryPoint;
    }

    @Override
    public String toString() {
        return "GeneratorConfig{runtimeModule=" + runtimeModule
                + ", indentWidth=" + indentWidth
                + ", entryPoint=" + entryPoint + '}';
    }

    public static final class Builder {
        private String runtimeModule = DEFAULT_RUNTIME_MODULE;
        private int indentWidth = DEFAULT_INDENT_WIDTH;
        private String entryPoint = DEFAULT_ENTRY_POINT;

        private Builder() {
        }

        public Builder runtimeModule(String runtimeModule) {
            Objects.requireNonNull(runtimeModule, "runtimeModule");
            if (!MODULE.matcher(runtimeModule).matches()) {
                throw new IllegalArgumentException("not a module name: " + runtimeModule);
            }
            this.runtimeModule = runtimeModule;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            if (indentWidth < 1 || indentWidth > 8) {
                throw new IllegalArgumentException("indent width must be between 1 and 8, got " + indentWidth);
            }
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder entryPoint(String entryPoint) {
            Objects.requireNonNull(entryPoint, "entryPoint");
            if (!IDENTIFIER.matcher(entryPoint).matches()) {
                throw new IllegalArgumentException("not an identifier: " + entryPoint);
            }
            this.entryPoint = entryPoint;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(this);
        }
    }
}
