package com.qualitygate.core.analyzer;

import com.qualitygate.core.analyzer.impl.architecture.ArchitectureAnalyzer;
import com.qualitygate.core.analyzer.impl.coverage.CoverageAnalyzer;
import com.qualitygate.core.analyzer.impl.quality.CodeQualityAnalyzer;
import com.qualitygate.core.analyzer.impl.security.SecurityAnalyzer;
import com.qualitygate.core.model.AnalysisCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Lookup table from analyzer type keys to analyzer constructors.
 *
 * <p>{@link #create(String, AnalyzerSettings)} always builds a fresh instance, while
 * {@link #getInstance(String, AnalyzerSettings)} memoizes one instance per type until
 * {@link #clearInstances()} is called. Registries are plain objects owned by the pipeline's
 * composition root; tests build their own instead of resetting shared state.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalyzerRegistry registry = AnalyzerRegistry.withBuiltIns().loadProviders();
 * Analyzer coverage = registry.create("coverage", AnalyzerSettings.defaults("CoverageAnalyzer"));
 * }</pre>
 */
public class AnalyzerRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

    private final Map<String, Function<AnalyzerSettings, Analyzer>> constructors = new LinkedHashMap<>();
    private final Map<String, Analyzer> instances = new ConcurrentHashMap<>();

    /**
     * Creates a registry holding the four built-in analyzers.
     *
     * @return registry with built-ins
     */
    public static AnalyzerRegistry withBuiltIns() {
        AnalyzerRegistry registry = new AnalyzerRegistry();
        registry.register(AnalysisCategory.CODE_QUALITY.analyzerType(), CodeQualityAnalyzer::new);
        registry.register(AnalysisCategory.TEST_COVERAGE.analyzerType(), CoverageAnalyzer::new);
        registry.register(AnalysisCategory.ARCHITECTURE.analyzerType(), ArchitectureAnalyzer::new);
        registry.register(AnalysisCategory.SECURITY.analyzerType(), SecurityAnalyzer::new);
        return registry;
    }

    /**
     * Registers every {@link AnalyzerProvider} visible to the context class loader.
     *
     * @return this registry
     */
    public AnalyzerRegistry loadProviders() {
        return loadProviders(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Registers every {@link AnalyzerProvider} visible to the given class loader.
     *
     * @param classLoader class loader to search
     * @return this registry
     */
    public AnalyzerRegistry loadProviders(ClassLoader classLoader) {
        ServiceLoader<AnalyzerProvider> loader = ServiceLoader.load(AnalyzerProvider.class, classLoader);
        for (AnalyzerProvider provider : loader) {
            log.debug("Discovered analyzer provider {} for type '{}'", provider.getClass().getName(), provider.getType());
            register(provider.getType(), provider::create);
        }
        return this;
    }

    /**
     * Registers a constructor under a type key.
     *
     * <p>Registering an existing type logs a warning and replaces the previous constructor.
     * A memoized instance of the old constructor is dropped.
     *
     * @param type analyzer type key
     * @param constructor factory producing a new analyzer from settings
     */
    public synchronized void register(String type, Function<AnalyzerSettings, Analyzer> constructor) {
        if (constructors.containsKey(type)) {
            log.warn("Analyzer type '{}' is already registered, overwriting", type);
            instances.remove(type);
        }
        constructors.put(type, constructor);
    }

    public synchronized boolean isRegistered(String type) {
        return constructors.containsKey(type);
    }

    /**
     * @return registered type keys in registration order
     */
    public synchronized List<String> registeredTypes() {
        return List.copyOf(constructors.keySet());
    }

    /**
     * Creates a new analyzer instance.
     *
     * @param type analyzer type key
     * @param settings settings for the instance
     * @return new analyzer
     * @throws UnknownAnalyzerTypeException if the type is not registered
     */
    public Analyzer create(String type, AnalyzerSettings settings) {
        Function<AnalyzerSettings, Analyzer> constructor;
        synchronized (this) {
            constructor = constructors.get(type);
            if (constructor == null) {
                throw new UnknownAnalyzerTypeException(type, constructors.keySet());
            }
        }
        return constructor.apply(settings);
    }

    /**
     * Returns the memoized instance for a type, creating it on first use.
     *
     * <p>Settings only apply to the call that creates the instance.
     *
     * @param type analyzer type key
     * @param settings settings used if the instance does not exist yet
     * @return shared analyzer instance
     * @throws UnknownAnalyzerTypeException if the type is not registered
     */
    public Analyzer getInstance(String type, AnalyzerSettings settings) {
        Analyzer existing = instances.get(type);
        if (existing != null) {
            return existing;
        }
        Analyzer created = create(type, settings);
        Analyzer raced = instances.putIfAbsent(type, created);
        return raced != null ? raced : created;
    }

    /**
     * Drops all memoized instances.
     */
    public void clearInstances() {
        instances.clear();
    }

    /**
     * Creates one fresh analyzer per registered type.
     *
     * @param settingsForType settings lookup per type key
     * @return analyzers in registration order
     */
    public List<Analyzer> createAll(Function<String, AnalyzerSettings> settingsForType) {
        List<Analyzer> analyzers = new ArrayList<>();
        for (String type : registeredTypes()) {
            analyzers.add(create(type, settingsForType.apply(type)));
        }
        return analyzers;
    }
}
