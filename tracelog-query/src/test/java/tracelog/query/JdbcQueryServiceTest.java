/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tracelog.LogRecord;
import tracelog.Span;
import tracelog.collector.SpanCollector;
import tracelog.storage.StorageComponent;
import tracelog.storage.TenantStorageManager;
import tracelog.storage.jdbc.JdbcStorageFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static tracelog.query.QueryServiceTest.CHECKOUT;
import static tracelog.query.QueryServiceTest.CHECKOUT_QUERY;
import static tracelog.query.QueryServiceTest.LOGIN;
import static tracelog.query.QueryServiceTest.TODAY;

/** Same queries, against the embedded database of two tenants. */
class JdbcQueryServiceTest {
  @TempDir Path directory;
  TenantStorageManager manager;
  QueryService service;

  @BeforeEach void open() throws IOException {
    manager = TenantStorageManager.newBuilder()
      .storageFactory(JdbcStorageFactory.newBuilder().directory(directory).build())
      .multiTenant(true)
      .build();
    service = QueryService.create(manager);

    StorageComponent acme = manager.get("acme");
    for (Span span : List.of(CHECKOUT, CHECKOUT_QUERY, LOGIN)) {
      acme.spanConsumer().accept(span).execute();
    }
    acme.logConsumer().accept(LogRecord.newBuilder()
      .timestamp(TODAY)
      .level("error")
      .message("card declined")
      .traceId(CHECKOUT.traceId())
      .build()).execute();
  }

  @AfterEach void close() throws IOException {
    manager.close();
  }

  @Test void listTraces() throws IOException {
    QueryResult<TraceSummary> result =
      service.listTraces("acme", TraceQuery.fromParameters(Map.of()));

    assertThat(result.total()).isEqualTo(2L);
    assertThat(result.data()).extracting(TraceSummary::traceId)
      .containsExactly(LOGIN.traceId(), CHECKOUT.traceId());
    assertThat(result.data().get(1).spanCount()).isEqualTo(2L);
    assertThat(result.data().get(1).errorCount()).isEqualTo(1L);
  }

  @Test void getTrace() throws IOException {
    assertThat(service.getTrace("acme", CHECKOUT.traceId()).spans())
      .containsExactly(CHECKOUT, CHECKOUT_QUERY);
  }

  @Test void listLogs_byTraceId() throws IOException {
    QueryResult<LogRecord> result = service.listLogs("acme",
      LogQuery.fromParameters(Map.of("trace_id", CHECKOUT.traceId())));

    assertThat(result.data()).extracting(LogRecord::message).containsExactly("card declined");
    assertThat(result.data().get(0).id()).isPositive();
  }

  @Test void tenantsAreIsolated() throws IOException {
    QueryResult<TraceSummary> result =
      service.listTraces("other", TraceQuery.fromParameters(Map.of()));

    assertThat(result.data()).isEmpty();
    assertThat(result.total()).isZero();
  }

  /** Spans of one trace arrive in more than one batch, newest first, and read back in order. */
  @Test void getTrace_collectedAcrossBatches() throws Exception {
    SpanCollector collector = SpanCollector.newBuilder()
      .storageManager(manager)
      .tenant("acme")
      .batchSize(100)
      .build();
    String rootId = String.format("%016x", 1);
    for (int i = 150; i >= 1; i--) {
      collector.accept(Span.newBuilder()
        .traceId("T1")
        .spanId(String.format("%016x", i))
        .parentSpanId(i == 1 ? null : rootId)
        .name("op-" + i)
        .startTime(TODAY + i * 1_000_000L)
        .endTime(TODAY + i * 1_000_000L + 500_000L)
        .build());
    }
    collector.shutdown(Duration.ofSeconds(10));

    List<Span> spans = service.getTrace("acme", "T1").spans();
    assertThat(spans).hasSize(150)
      .isSortedAccordingTo(Comparator.comparingLong(Span::startTime));
    assertThat(spans.get(0).spanId()).isEqualTo(rootId);
  }
}
