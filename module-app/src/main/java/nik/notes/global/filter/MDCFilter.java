package nik.notes.global.filter;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.executor.TaskContext;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 로그 추적용 MDC 필터
 *
 * <h4>MDC 키</h4>
 *
 * <ul>
 *   <li>{@link #TRACE_ID_KEY}: 요청 추적용 Correlation ID (logback 패턴의 {@code %X{traceId}})
 * </ul>
 *
 * <h4>비동기 전파</h4>
 *
 * <p>{@code ExecutorConfig.contextPropagatingDecorator()}가 이 MDC 값을 생성 워커 스레드로 전파합니다.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class MDCFilter implements Filter {

  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

  public static final String TRACE_ID_KEY = "traceId";

  private final LogicExecutor executor;

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    HttpServletRequest httpRequest = (HttpServletRequest) request;
    HttpServletResponse httpResponse = (HttpServletResponse) response;

    String correlationId = resolveCorrelationId(httpRequest);
    MDC.put(TRACE_ID_KEY, correlationId);
    httpResponse.setHeader(CORRELATION_ID_HEADER, correlationId);

    executor.executeWithFinally(
        () -> {
          chain.doFilter(request, response);
          return null;
        },
        MDC::clear,
        TaskContext.of("Filter", "MDC", correlationId));
  }

  private String resolveCorrelationId(HttpServletRequest request) {
    String id = request.getHeader(CORRELATION_ID_HEADER);
    return (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
  }
}
