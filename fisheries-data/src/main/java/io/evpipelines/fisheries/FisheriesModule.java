package io.evpipelines.fisheries;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.evpipelines.fisheries.rules.SchemaRules;
import io.evpipelines.fisheries.rules.SchemaRulesLoader;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public class FisheriesModule extends AbstractModule {
    private final FisheriesConfig config;
    private final Set<DatasetVariant> variants;

    public FisheriesModule(FisheriesConfig config, Set<DatasetVariant> variants) {
        this.config = config;
        this.variants = EnumSet.copyOf(variants);
    }

    @Override
    protected void configure() {
        bind(FisheriesConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Clock clock() { return Clock.systemDefaultZone(); }

    @Provides @Singleton SchemaRulesLoader rulesLoader() { return new SchemaRulesLoader(); }

    /** Rules for the selected variants only, loaded before any data is read. Other overrides are not opened. */
    @Provides @Singleton Map<DatasetVariant, SchemaRules> rules(SchemaRulesLoader loader) {
        Map<DatasetVariant, SchemaRules> m = new EnumMap<>(DatasetVariant.class);
        for (DatasetVariant v : variants) {
            m.put(v, loader.load(v, config.rulesOverride(v)));
        }
        return m;
    }

    @Provides @Singleton FisheriesCleaningPipeline pipeline(Map<DatasetVariant, SchemaRules> rules, MetricRegistry registry, Clock clock) {
        return new FisheriesCleaningPipeline(config, rules, registry, clock);
    }
}
