package dev.scriptorium.index;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Resolves embedding function names to in-process langchain4j {@link EmbeddingModel}s.
 *
 * <p>Names are matched case-insensitively. Models are created on first use and then shared; the
 * ONNX models are thread-safe.
 */
public class EmbeddingModelRegistry {

    public static final String ALL_MINILM_L6_V2 = "all-MiniLM-L6-v2";
    public static final String BGE_SMALL_EN_V15_Q = "bge-small-en-v1.5-q";

    private final Map<String, Supplier<EmbeddingModel>> factories = new LinkedHashMap<>();
    private final Map<String, EmbeddingModel> loaded = new ConcurrentHashMap<>();

    public EmbeddingModelRegistry(Map<String, Supplier<EmbeddingModel>> factories) {
        factories.forEach((name, factory) -> this.factories.put(key(name), factory));
    }

    /** Registry with the bundled ONNX models (384 dimensions each). */
    public static EmbeddingModelRegistry withDefaults() {
        Map<String, Supplier<EmbeddingModel>> factories = new LinkedHashMap<>();
        factories.put(ALL_MINILM_L6_V2, AllMiniLmL6V2EmbeddingModel::new);
        factories.put("sentence-transformers/" + ALL_MINILM_L6_V2, AllMiniLmL6V2EmbeddingModel::new);
        factories.put(BGE_SMALL_EN_V15_Q, BgeSmallEnV15QuantizedEmbeddingModel::new);
        return new EmbeddingModelRegistry(factories);
    }

    /**
     * Returns the model registered under {@code name}.
     *
     * @throws IllegalArgumentException if no model has that name
     */
    public EmbeddingModel resolve(String name) {
        Supplier<EmbeddingModel> factory = factoryFor(name);
        return loaded.computeIfAbsent(key(name), k -> factory.get());
    }

    /**
     * Checks that a model is registered under {@code name} without loading it.
     *
     * @throws IllegalArgumentException if no model has that name
     */
    public void requireKnown(String name) {
        factoryFor(name);
    }

    private Supplier<EmbeddingModel> factoryFor(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Embedding model name must not be blank");
        }
        Supplier<EmbeddingModel> factory = factories.get(key(name));
        if (factory == null) {
            throw new IllegalArgumentException(
                    "Unknown embedding model '" + name + "'; known models: " + factories.keySet());
        }
        return factory;
    }

    public Set<String> names() {
        return Set.copyOf(factories.keySet());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
