/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.funnelbuddy.analysis;

import com.google.inject.Binder;
import com.google.inject.Scopes;
import org.funnelbuddy.config.EventStoreConfig;
import org.funnelbuddy.config.FunnelConfig;
import org.funnelbuddy.plugin.FunnelBuddyModule;

import java.time.Clock;

import static io.airlift.configuration.ConfigBinder.configBinder;

public class FunnelAnalyzerModule
        extends FunnelBuddyModule {
    @Override
    protected void setup(Binder binder) {
        configBinder(binder).bindConfig(FunnelConfig.class);
        configBinder(binder).bindConfig(EventStoreConfig.class);

        binder.bind(Clock.class).toInstance(Clock.systemUTC());
        binder.bind(FunnelDefinitionValidator.class).in(Scopes.SINGLETON);
        binder.bind(FunnelAnalyticsService.class).in(Scopes.SINGLETON);
    }

    @Override
    public String name() {
        return "Funnel Analyzer Module";
    }

    @Override
    public String description() {
        return "Computes ordered step conversion of sessions for stored funnel definitions.";
    }
}
