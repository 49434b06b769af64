/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.server;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import tracelog.collector.CollectorMetrics;
import tracelog.collector.LogCollector;
import tracelog.collector.SpanCollector;
import tracelog.collector.otel.TracelogSpanExporter;
import tracelog.query.QueryResponseWriter;
import tracelog.query.QueryService;
import tracelog.storage.StorageFactory;
import tracelog.storage.TenantStorageManager;
import tracelog.storage.jdbc.JdbcStorageFactory;

@Configuration
@EnableConfigurationProperties(TracelogProperties.class)
public class TracelogConfiguration {

  @Bean @ConditionalOnMissingBean
  StorageFactory storageFactory(TracelogProperties tracelog) {
    return JdbcStorageFactory.newBuilder()
      .directory(tracelog.getStorage().directoryPath())
      .maxPoolSize(tracelog.getStorage().getMaxPoolSize())
      .build();
  }

  @Bean @ConditionalOnMissingBean
  TenantStorageManager tenantStorageManager(TracelogProperties tracelog,
    StorageFactory storageFactory) {
    return TenantStorageManager.newBuilder()
      .storageFactory(storageFactory)
      .multiTenant(tracelog.isMultiTenant())
      .build();
  }

  @Bean @ConditionalOnMissingBean
  CollectorMetrics collectorMetrics(ObjectProvider<MeterRegistry> registry) {
    MeterRegistry meterRegistry = registry.getIfAvailable();
    return meterRegistry != null
      ? new MicrometerCollectorMetrics(meterRegistry)
      : CollectorMetrics.NOOP_METRICS;
  }

  @Bean @ConditionalOnMissingBean
  SpanCollector spanCollector(TracelogProperties tracelog, TenantStorageManager storageManager,
    CollectorMetrics metrics) {
    return tracelog.getCollector().configure(SpanCollector.newBuilder())
      .storageManager(storageManager)
      .metrics(metrics)
      .build();
  }

  @Bean @ConditionalOnMissingBean
  LogCollector logCollector(TracelogProperties tracelog, TenantStorageManager storageManager,
    CollectorMetrics metrics) {
    return tracelog.getCollector().configure(LogCollector.newBuilder())
      .storageManager(storageManager)
      .metrics(metrics)
      .build();
  }

  @Bean @ConditionalOnMissingBean
  TracelogSpanExporter tracelogSpanExporter(TracelogProperties tracelog,
    SpanCollector spanCollector) {
    return TracelogSpanExporter.create(spanCollector,
      tracelog.getCollector().getShutdownTimeout());
  }

  @Bean @ConditionalOnMissingBean
  QueryService queryService(TenantStorageManager storageManager) {
    return QueryService.create(storageManager);
  }

  @Bean @ConditionalOnMissingBean
  QueryResponseWriter queryResponseWriter() {
    return QueryResponseWriter.create();
  }

  @Bean(destroyMethod = "shutdown")
  ThreadPoolTaskScheduler tracelogScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setThreadNamePrefix("TracelogEvictor-");
    scheduler.setDaemon(true);
    scheduler.initialize();
    return scheduler;
  }

  @Bean
  TenantIdleEvictor tenantIdleEvictor(TracelogProperties tracelog,
    TenantStorageManager storageManager,
    @Qualifier("tracelogScheduler") ThreadPoolTaskScheduler tracelogScheduler) {
    TracelogProperties.Tenant tenant = tracelog.getTenant();
    return new TenantIdleEvictor(storageManager, tracelogScheduler, tenant.getMaxIdle(),
      tenant.getEvictionInterval());
  }
}
