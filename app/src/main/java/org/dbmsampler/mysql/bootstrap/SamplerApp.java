/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.dbmsampler.mysql.bootstrap;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.dbmsampler.mysql.common.HostUtils;
import org.dbmsampler.mysql.config.CheckConfig;
import org.dbmsampler.mysql.config.SamplerConfig;
import org.dbmsampler.mysql.db.DatabaseService;
import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.MySqlVersion;
import org.dbmsampler.mysql.sampler.StatementSampler;

import java.util.List;

/**
 * Application lifecycle bean and host check.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Startup: print banner, log configuration, detect server version</li>
 *   <li>Runtime: a check run every collection interval tests connectivity and drives the sampler</li>
 *   <li>Shutdown: stop the sampler loop and close its connection</li>
 * </ol>
 */
@Slf4j
@ApplicationScoped
public class SamplerApp {
    private final DatabaseService databaseService;
    private final StatementSampler sampler;
    private final SamplerMetrics metrics;
    private final SamplerConfig samplerConfig;
    private final CheckConfig checkConfig;
    private final Banners banner;

    @Inject
    public SamplerApp(DatabaseService databaseService,
                      StatementSampler sampler,
                      SamplerMetrics metrics,
                      SamplerConfig samplerConfig,
                      CheckConfig checkConfig,
                      Banners banner) {
        this.databaseService = databaseService;
        this.sampler = sampler;
        this.metrics = metrics;
        this.samplerConfig = samplerConfig;
        this.checkConfig = checkConfig;
        this.banner = banner;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();
        logConfiguration();
        detectAndLogVersion();
        banner.printFooter(samplerConfig.enabled());
    }

    void onShutdown(@Observes ShutdownEvent event) {
        banner.printShutdown();
        sampler.stop();
    }

    private void logConfiguration() {
        log.info("Configuration:");
        log.info("  Collection interval:    {}", checkConfig.minCollectionInterval());
        log.info("  Statement samples:      {}", samplerConfig.enabled() ? "enabled" : "disabled");
        log.info("  Run synchronously:      {}", samplerConfig.runSync());
        log.info("  Row limit:              {}", samplerConfig.eventsStatementsRowLimit());
        log.info("  Host:                   {}", HostUtils.resolveDbHost(checkConfig.host()));
        log.info("  Database URL:           {}", HostUtils.maskSensitiveInfo(databaseService.getUrl()));
    }

    private void detectAndLogVersion() {
        try {
            MySqlVersion version = databaseService.detectVersion();
            log.info("Database connection successful:");
            log.info("  MySQL version:          {}", version.fullVersion());
            log.info("  Flavor:                 {}", version.isMariaDb() ? "MariaDB" : "MySQL");
            if (!version.supportsJsonExplain()) {
                log.warn("Server version {} does not support EXPLAIN FORMAT=json, samples will carry no plans",
                        version.fullVersion());
            }
        } catch (Exception e) {
            log.warn("Error detecting MySQL version on startup: {}", e.getMessage());
            log.debug("Version detection error details:", e);
        }
    }

    /**
     * Periodic check run. Concurrent execution is skipped.
     */
    @Scheduled(every = "${app.check.min-collection-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void runCheck() {
        log.debug("Check run triggered");
        try {
            boolean up = databaseService.testConnection();
            metrics.setMySqlUp(up);
            if (!up) {
                log.warn("MySQL is not reachable, skipping statement sampling for this run");
                return;
            }
            sampler.runSampler(checkConfig.tags().orElse(List.of()));
        } catch (Exception e) {
            // the scheduler must keep running
            log.error("Unexpected error in check run: {}", e.getMessage(), e);
        }
    }
}
