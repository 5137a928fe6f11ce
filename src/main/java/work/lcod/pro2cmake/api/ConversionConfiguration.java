package work.lcod.pro2cmake.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for converting one qmake project file.
 */
public record ConversionConfiguration(
    Path projectFile,
    boolean debugParser,
    boolean debugParseResult,
    boolean debugParseDictionary,
    boolean debugProStructure,
    boolean debugFullProStructure,
    boolean recursive,
    Optional<Path> mappingsFile,
    LogLevel logLevel
) {
    public ConversionConfiguration {
        Objects.requireNonNull(projectFile, "projectFile");
        Objects.requireNonNull(mappingsFile, "mappingsFile");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path projectFile;
        private boolean debugParser;
        private boolean debugParseResult;
        private boolean debugParseDictionary;
        private boolean debugProStructure;
        private boolean debugFullProStructure;
        private boolean recursive;
        private Optional<Path> mappingsFile = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder projectFile(Path projectFile) {
            this.projectFile = projectFile;
            return this;
        }

        /** Turns on every debug dump and the parser trace. */
        public Builder debug(boolean debug) {
            if (debug) {
                this.debugParser = true;
                this.debugParseResult = true;
                this.debugParseDictionary = true;
                this.debugProStructure = true;
                this.debugFullProStructure = true;
            }
            return this;
        }

        public Builder debugParser(boolean debugParser) {
            this.debugParser = debugParser;
            return this;
        }

        public Builder debugParseResult(boolean debugParseResult) {
            this.debugParseResult = debugParseResult;
            return this;
        }

        public Builder debugParseDictionary(boolean debugParseDictionary) {
            this.debugParseDictionary = debugParseDictionary;
            return this;
        }

        public Builder debugProStructure(boolean debugProStructure) {
            this.debugProStructure = debugProStructure;
            return this;
        }

        public Builder debugFullProStructure(boolean debugFullProStructure) {
            this.debugFullProStructure = debugFullProStructure;
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder mappingsFile(Optional<Path> mappingsFile) {
            this.mappingsFile = mappingsFile;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ConversionConfiguration build() {
            return new ConversionConfiguration(
                projectFile,
                debugParser,
                debugParseResult,
                debugParseDictionary,
                debugProStructure,
                debugFullProStructure,
                recursive,
                mappingsFile,
                logLevel
            );
        }
    }
}
