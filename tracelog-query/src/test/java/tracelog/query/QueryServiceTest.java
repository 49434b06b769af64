/*
 * Copyright The Tracelog Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelog.query;

import com.github.valfirst.slf4jtest.LoggingEvent;
import com.github.valfirst.slf4jtest.TestLoggerFactoryExtension;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.event.Level;
import tracelog.Call;
import tracelog.LogRecord;
import tracelog.Span;
import tracelog.storage.InMemoryStorage;
import tracelog.storage.SpanStore;
import tracelog.storage.StorageComponent;
import tracelog.storage.TenantStorageManager;

import static com.github.valfirst.slf4jtest.TestLoggerFactory.getLoggingEvents;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(TestLoggerFactoryExtension.class)
class QueryServiceTest {
  static final long TODAY = 1_704_067_200_000_000_000L, MILLIS = 1_000_000L;

  static final Span CHECKOUT = Span.newBuilder()
    .traceId("4bf92f3577b34da6a3ce929d0e0e4736")
    .spanId("00f067aa0ba902b7")
    .name("GET /checkout")
    .serviceName("frontend")
    .startTime(TODAY)
    .endTime(TODAY + 250 * MILLIS + 500_000L)
    .build();
  static final Span CHECKOUT_QUERY = Span.newBuilder()
    .traceId(CHECKOUT.traceId())
    .spanId("b7ad6b7169203331")
    .parentSpanId(CHECKOUT.spanId())
    .name("SELECT orders")
    .startTime(TODAY + 10 * MILLIS)
    .endTime(TODAY + 90 * MILLIS)
    .hasError(true)
    .build();
  static final Span LOGIN = Span.newBuilder()
    .traceId("0af7651916cd43dd8448eb211c80319c")
    .spanId("53995c3f42cd8ad8")
    .name("POST /login")
    .startTime(TODAY + 1000 * MILLIS)
    .endTime(TODAY + 1100 * MILLIS)
    .build();

  InMemoryStorage storage = InMemoryStorage.create();
  QueryService service = QueryService.create(TenantStorageManager.newBuilder()
    .storageFactory(tenantId -> storage)
    .build());

  @BeforeEach void store() throws IOException {
    for (Span span : List.of(CHECKOUT, CHECKOUT_QUERY, LOGIN)) {
      storage.spanConsumer().accept(span).execute();
    }
  }

  @Test void listTraces_newestRootFirst() throws IOException {
    QueryResult<TraceSummary> result =
      service.listTraces("default", TraceQuery.newBuilder().build());

    assertThat(result.total()).isEqualTo(2L);
    assertThat(result.limit()).isEqualTo(100);
    assertThat(result.offset()).isZero();
    assertThat(result.data()).extracting(TraceSummary::rootSpanName)
      .containsExactly("POST /login", "GET /checkout");

    TraceSummary checkout = result.data().get(1);
    assertThat(checkout.traceId()).isEqualTo(CHECKOUT.traceId());
    assertThat(checkout.traceStartTime()).isEqualTo(TODAY);
    assertThat(checkout.durationMs()).isEqualTo(250.5);
    assertThat(checkout.spanCount()).isEqualTo(2L);
    assertThat(checkout.errorCount()).isEqualTo(1L);
    assertThat(checkout.hasError()).isTrue();
  }

  @Test void listTraces_nameFilterIgnoresCase() throws IOException {
    QueryResult<TraceSummary> result =
      service.listTraces("default", TraceQuery.newBuilder().q("CHECKOUT").build());

    assertThat(result.data()).extracting(TraceSummary::traceId)
      .containsExactly(CHECKOUT.traceId());
    assertThat(result.total()).isEqualTo(2L); // unfiltered
  }

  @Test void listTraces_errorFilter() throws IOException {
    assertThat(service.listTraces("default", TraceQuery.newBuilder().hasError(true).build())
      .data()).extracting(TraceSummary::traceId)
      .containsExactly(CHECKOUT.traceId());

    assertThat(service.listTraces("default", TraceQuery.newBuilder().hasError(false).build())
      .data()).extracting(TraceSummary::traceId)
      .containsExactly(LOGIN.traceId());
  }

  @Test void listTraces_paginates() throws IOException {
    QueryResult<TraceSummary> result =
      service.listTraces("default", TraceQuery.newBuilder().limit(1).offset(1).build());

    assertThat(result.data()).extracting(TraceSummary::traceId)
      .containsExactly(CHECKOUT.traceId());
    assertThat(result.total()).isEqualTo(2L);
  }

  @Test void listTraces_missingStatsCountRootAlone() throws IOException {
    Call<Long> failingCount = mock(Call.class);
    when(failingCount.execute()).thenThrow(new IOException("database closed"));
    SpanStore spanStore = mock(SpanStore.class);
    when(spanStore.getRootSpans(anyInt(), anyInt())).thenReturn(Call.create(List.of(LOGIN)));
    when(spanStore.getTraceStats(any())).thenReturn(Call.emptyList());
    when(spanStore.countTraces()).thenReturn(failingCount);
    StorageComponent storage = mock(StorageComponent.class);
    when(storage.spanStore()).thenReturn(spanStore);
    QueryService service = QueryService.create(TenantStorageManager.newBuilder()
      .storageFactory(tenantId -> storage)
      .build());

    QueryResult<TraceSummary> result =
      service.listTraces("default", TraceQuery.newBuilder().build());

    assertThat(result.data()).hasSize(1);
    assertThat(result.data().get(0).spanCount()).isEqualTo(1L);
    assertThat(result.data().get(0).errorCount()).isZero();
    assertThat(result.total()).isZero();
    assertThat(getLoggingEvents())
      .filteredOn(event -> event.getLevel() == Level.WARN)
      .extracting(LoggingEvent::getMessage)
      .containsExactly("Could not count results for tenant {}: reporting total 0");
  }

  @Test void getTrace_ordersByStartTime() throws IOException {
    TraceDetail detail = service.getTrace("default", CHECKOUT.traceId());

    assertThat(detail.traceId()).isEqualTo(CHECKOUT.traceId());
    assertThat(detail.spans()).containsExactly(CHECKOUT, CHECKOUT_QUERY);
  }

  @Test void getTrace_notFound() {
    assertThatThrownBy(() -> service.getTrace("default", "ffffffffffffffffffffffffffffffff"))
      .isInstanceOf(TraceNotFoundException.class)
      .hasMessage("Trace not found: ffffffffffffffffffffffffffffffff");
  }

  @Test void getTrace_emptyId() {
    assertThatThrownBy(() -> service.getTrace("default", ""))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void listLogs_textFilterAppliesToThePage() throws IOException {
    for (int i = 0; i < 5; i++) {
      storage.logConsumer().accept(LogRecord.newBuilder()
        .timestamp(TODAY + i * MILLIS)
        .level(i % 2 == 0 ? "error" : "info")
        .message(i == 4 ? "Payment DECLINED" : "request " + i)
        .attributes(i == 0 ? "{\"reason\":\"declined by issuer\"}" : null)
        .build()).execute();
    }

    QueryResult<LogRecord> result = service.listLogs("default",
      LogQuery.fromParameters(Map.of("q", "declined", "limit", "3")));

    // page is records 4, 3, 2: record 0 matches but is on the next page
    assertThat(result.data()).extracting(LogRecord::message).containsExactly("Payment DECLINED");
    assertThat(result.total()).isEqualTo(5L);
    assertThat(result.limit()).isEqualTo(3);
  }

  @Test void listLogs_structuralFiltersCount() throws IOException {
    for (int i = 0; i < 5; i++) {
      storage.logConsumer().accept(LogRecord.newBuilder()
        .timestamp(TODAY + i * MILLIS)
        .level(i % 2 == 0 ? "error" : "info")
        .message("request " + i)
        .build()).execute();
    }

    QueryResult<LogRecord> result = service.listLogs("default",
      LogQuery.fromParameters(Map.of("level", "error", "limit", "2")));

    assertThat(result.data()).extracting(LogRecord::message)
      .containsExactly("request 4", "request 2");
    assertThat(result.total()).isEqualTo(3L);
  }
}
