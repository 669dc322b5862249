package io.casengine.cli.config;

import io.casengine.core.engine.CasConfig;
import io.casengine.core.model.Domain;
import io.casengine.core.model.TargetForm;
import java.util.Objects;

/**
 * Root configuration of the command-line front end.
 *
 * <p>
 * Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param engine        engine defaults passed to {@code CasEngine}
 * @param loggingFormat {@code text} or {@code json} (default: text)
 * @param loggingLevel  root log level (default: WARN, so stderr stays quiet)
 */
public record CliConfig(CasConfig engine, String loggingFormat, String loggingLevel) {

    /** All defaults. */
    public static final CliConfig DEFAULT = builder().build();

    public CliConfig {
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. Engine settings are forwarded to a {@link CasConfig.Builder}. */
    public static final class Builder {
        private final CasConfig.Builder engine = CasConfig.builder();
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder maxSteps(int maxSteps) {
            engine.maxSteps(maxSteps);
            return this;
        }

        public Builder targetForm(TargetForm targetForm) {
            engine.targetForm(targetForm);
            return this;
        }

        public Builder domain(Domain domain) {
            engine.domain(domain);
            return this;
        }

        public Builder defaultVariable(String defaultVariable) {
            engine.defaultVariable(defaultVariable);
            return this;
        }

        public Builder seriesOrder(int seriesOrder) {
            engine.seriesOrder(seriesOrder);
            return this;
        }

        public Builder numericFallback(boolean numericFallback) {
            engine.numericFallback(numericFallback);
            return this;
        }

        public Builder rootSearchMin(double rootSearchMin) {
            engine.rootSearchMin(rootSearchMin);
            return this;
        }

        public Builder rootSearchMax(double rootSearchMax) {
            engine.rootSearchMax(rootSearchMax);
            return this;
        }

        public Builder rootSearchSamples(int rootSearchSamples) {
            engine.rootSearchSamples(rootSearchSamples);
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * @throws IllegalArgumentException if an engine setting is out of range
         */
        public CliConfig build() {
            return new CliConfig(engine.build(), loggingFormat, loggingLevel);
        }
    }
}
