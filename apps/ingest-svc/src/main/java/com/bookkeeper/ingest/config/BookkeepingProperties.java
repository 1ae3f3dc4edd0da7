package com.bookkeeper.ingest.config;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "bookkeeping")
public record BookkeepingProperties(
        Ingest ingest,
        Ai ai,
        Db db
) {

    @ConstructorBinding
    public BookkeepingProperties {
        // every section is optional; accessors below fall back to defaults
    }

    public Ingest ingest() {
        return ingest != null ? ingest : new Ingest(null, null, null, null, null, null);
    }

    public Ai ai() {
        return ai != null ? ai : new Ai(null, null, null, null, null, null, null);
    }

    public Db db() {
        return db != null ? db : new Db(null);
    }

    public record Ingest(
            String inputDir,
            Boolean recursive,
            String sourceFrom,
            String assumeEncoding,
            List<String> invertedSources,
            List<String> dateFormats
    ) {
        public Ingest {
            invertedSources = invertedSources == null ? List.of() : List.copyOf(invertedSources);
            dateFormats = dateFormats == null ? List.of() : List.copyOf(dateFormats);
            if (assumeEncoding != null && assumeEncoding.isBlank()) {
                assumeEncoding = null;
            }
        }

        public boolean recursiveFlag() {
            return recursive != null && recursive;
        }

        public boolean hasInputDir() {
            return inputDir != null && !inputDir.isBlank();
        }

        public Set<String> invertedSourceKeys() {
            return invertedSources.stream()
                    .filter(s -> s != null && !s.isBlank())
                    .map(s -> s.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
        }
    }

    public record Ai(
            String provider,
            String model,
            String endpoint,
            String apiKey,
            Integer batchSize,
            Long pauseMillis,
            List<String> categories
    ) {
        public static final List<String> DEFAULT_CATEGORIES = List.of(
                "Groceries", "Dining", "Utilities", "Subscriptions", "Transportation",
                "Housing", "Healthcare", "Insurance", "Income", "Shopping", "Misc"
        );

        public Ai {
            if (batchSize != null && batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
            if (pauseMillis != null && pauseMillis < 0) {
                throw new IllegalArgumentException("pauseMillis must not be negative");
            }
            categories = categories == null || categories.isEmpty() ? DEFAULT_CATEGORIES : List.copyOf(categories);
        }

        public String providerOrDefault() {
            return (provider != null && !provider.isBlank()) ? provider.toLowerCase(Locale.ROOT) : "openai";
        }

        public String modelOrDefault() {
            return (model != null && !model.isBlank()) ? model : "gpt-4o-mini";
        }

        public String endpointOrDefault() {
            return (endpoint != null && !endpoint.isBlank()) ? endpoint : "https://api.openai.com/v1/chat/completions";
        }

        public int batchSizeOrDefault() {
            return batchSize != null ? batchSize : 50;
        }

        public long pauseMillisOrDefault() {
            return pauseMillis != null ? pauseMillis : 2_000L;
        }

        public String fallbackCategory() {
            return categories.contains("Misc") ? "Misc" : categories.get(categories.size() - 1);
        }
    }

    public record Db(Boolean bootstrapEnabled) {
        public boolean bootstrapFlag() {
            return bootstrapEnabled != null && bootstrapEnabled;
        }
    }
}
