package org.boxworld.pddl.planner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * How to invoke an external planner. The command line built from it is
 * {@code <executable> <extra arguments> <domain> <problem> [<plan flag>] <plan file>}.
 */
public final class PlannerConfig {
    private final String executable;
    private final List<String> extraArguments;
    private final String planFlag;
    private final Path domainFile;
    private final Duration timeout;
    private final boolean keepFiles;

    private PlannerConfig(Builder builder) {
        this.executable = Objects.requireNonNull(builder.executable, "executable");
        this.extraArguments = Collections.unmodifiableList(new ArrayList<>(builder.extraArguments));
        this.planFlag = builder.planFlag;
        this.domainFile = builder.domainFile;
        this.timeout = builder.timeout;
        this.keepFiles = builder.keepFiles;
    }

    public static Builder builder(String executable) {
        return new Builder(executable);
    }

    public String getExecutable() {
        return executable;
    }

    public List<String> getExtraArguments() {
        return extraArguments;
    }

    /**
     * @return the flag preceding the plan file path; empty when the path is positional
     */
    public Optional<String> getPlanFlag() {
        return Optional.ofNullable(planFlag);
    }

    /**
     * @return the domain file to pass; empty to use the bundled BOX-WORLD domain
     */
    public Optional<Path> getDomainFile() {
        return Optional.ofNullable(domainFile);
    }

    /**
     * @return the maximum run time; empty to wait indefinitely
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * @return whether the working directory is left in place after the run
     */
    public boolean isKeepFiles() {
        return keepFiles;
    }

    /**
     * Builder of {@link PlannerConfig}.
     */
    public static final class Builder {
        private final String executable;
        private final List<String> extraArguments = new ArrayList<>();
        private String planFlag;
        private Path domainFile;
        private Duration timeout;
        private boolean keepFiles;

        private Builder(String executable) {
            this.executable = executable;
        }

        public Builder extraArguments(List<String> arguments) {
            this.extraArguments.addAll(arguments);
            return this;
        }

        public Builder planFlag(String flag) {
            this.planFlag = flag;
            return this;
        }

        /**
         * Sets the domain file. A relative path is resolved against the current directory here,
         * since the planner runs in its own working directory.
         */
        public Builder domainFile(Path file) {
            this.domainFile = file == null ? null : file.toAbsolutePath();
            return this;
        }

        public Builder timeout(Duration duration) {
            this.timeout = duration;
            return this;
        }

        public Builder keepFiles(boolean keep) {
            this.keepFiles = keep;
            return this;
        }

        public PlannerConfig build() {
            return new PlannerConfig(this);
        }
    }
}
