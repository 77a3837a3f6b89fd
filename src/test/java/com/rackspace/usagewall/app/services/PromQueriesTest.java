/*
 * Copyright 2023 Rackspace US, Inc.
 *
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

package com.rackspace.usagewall.app.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.usagewall.app.config.AppProperties;
import com.rackspace.usagewall.app.model.Resource;
import org.junit.jupiter.api.Test;

class PromQueriesTest {

  private final PromQueries promQueries = new PromQueries(new AppProperties());

  @Test
  void rendersUsageQuery() {
    assertThat(promQueries.usage("account", Resource.gpus))
        .isEqualTo("sum by(account) (slurm_job_gpus{state=\"running\",job=\"slurm\"})");
  }

  @Test
  void rendersCapacityQuery() {
    assertThat(promQueries.capacity("nodes", Resource.bytes))
        .isEqualTo("sum by(nodes) (slurm_node_bytes{state!=\"drain\",state!=\"down\"})");
  }

  @Test
  void rendersConfiguredTemplate() {
    final PromQueries custom = new PromQueries(new AppProperties()
        .setUsageQueryTemplate("sum by({grouping}) (usage_{resource})"));

    assertThat(custom.usage("partition", Resource.cpus))
        .isEqualTo("sum by(partition) (usage_cpus)");
  }

  @Test
  void rejectsGroupingThatIsNotALabel() {
    assertThatThrownBy(() -> promQueries.usage("account) or (vector(1)", Resource.cpus))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
