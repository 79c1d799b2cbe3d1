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
package org.funnelbuddy.postgresql.analysis;

import org.funnelbuddy.analysis.AbstractFunnelQueryCompiler;
import org.funnelbuddy.config.EventStoreConfig;

import javax.inject.Inject;

import static java.lang.String.format;

public class PostgresqlFunnelQueryCompiler
        extends AbstractFunnelQueryCompiler {
    @Inject
    public PostgresqlFunnelQueryCompiler(EventStoreConfig config) {
        super(config);
    }

    @Override
    protected String containsPredicate(String column) {
        return format("strpos(%s, ?) > 0", column);
    }

    @Override
    protected String firstValueAggregate(String column, String orderColumn) {
        return format("(array_agg(%s ORDER BY %s))[1]", column, orderColumn);
    }
}
