package org.funnelbuddy.plugin;

import com.google.inject.Binder;
import com.google.inject.name.Names;
import io.airlift.configuration.ConfigurationAwareModule;
import io.airlift.configuration.ConfigurationFactory;

import javax.validation.constraints.NotNull;

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static io.airlift.configuration.ConfigBinder.configBinder;

public abstract class FunnelBuddyModule
        implements ConfigurationAwareModule {
    private ConfigurationFactory configurationFactory;
    private Binder binder;

    @Override
    public synchronized void setConfigurationFactory(ConfigurationFactory configurationFactory) {
        this.configurationFactory = checkNotNull(configurationFactory, "configurationFactory is null");
    }

    @Override
    public final synchronized void configure(Binder binder) {
        checkState(this.binder == null, "re-entry not allowed");
        this.binder = checkNotNull(binder, "binder is null");

        try {
            ConditionalModule annotation = this.getClass().getAnnotation(ConditionalModule.class);
            if (annotation != null) {
                configurationFactory.consumeProperty(annotation.config());
                String value = Optional.ofNullable(configurationFactory.getProperties().get(annotation.config()))
                        .map(String::trim).orElse(null);
                if (!Objects.equals(annotation.value(), value)) {
                    return;
                }
            }

            setup(binder);
        } finally {
            this.binder = null;
        }
    }

    protected synchronized <T> void bindConfig(Class<T> configClass, String prefix) {
        configBinder(binder).bindConfig(configClass, Names.named(prefix), prefix);
    }

    protected synchronized String getConfig(String config) {
        String value = configurationFactory.getProperties().get(config);
        configurationFactory.consumeProperty(config);
        return value;
    }

    protected synchronized void install(FunnelBuddyModule module) {
        module.setConfigurationFactory(configurationFactory);
        binder.install(module);
    }

    protected abstract void setup(Binder binder);

    @NotNull
    public abstract String name();

    public abstract String description();
}
