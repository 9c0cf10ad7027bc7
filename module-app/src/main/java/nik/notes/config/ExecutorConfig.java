package nik.notes.config;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import nik.notes.infrastructure.executor.DefaultLogicExecutor;
import nik.notes.infrastructure.executor.LogicExecutor;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor Configuration
 *
 * <ul>
 *   <li><b>logicExecutor</b>: 기본 번역기(InternalSystemException)를 쓰는 Primary LogicExecutor
 *   <li><b>generationTaskExecutor</b>: 생성 백엔드 호출 전용 풀. 포화 시 AbortPolicy (거부되면 mock으로 대체)
 *   <li><b>contextPropagatingDecorator</b>: MDC(traceId)를 워커 스레드로 전파
 * </ul>
 */
@Configuration
public class ExecutorConfig {

  @Bean
  @Primary
  @ConditionalOnMissingBean(LogicExecutor.class)
  public LogicExecutor logicExecutor() {
    return new DefaultLogicExecutor();
  }

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * MDC 전파용 TaskDecorator (snapshot/restore)
   *
   * <p>호출 스레드의 MDC를 캡처해 워커에 설정하고, 작업 후 워커의 원래 MDC로 되돌립니다.
   */
  @Bean
  public TaskDecorator contextPropagatingDecorator() {
    return runnable -> {
      Map<String, String> captured = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> before = MDC.getCopyOfContextMap();
        restore(captured);
        try {
          runnable.run();
        } finally {
          restore(before);
        }
      };
    };
  }

  @Bean(name = "generationTaskExecutor", destroyMethod = "shutdown")
  public ThreadPoolTaskExecutor generationTaskExecutor(TaskDecorator contextPropagatingDecorator) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("generation-");
    executor.setAllowCoreThreadTimeOut(true);
    executor.setKeepAliveSeconds(60);
    executor.setTaskDecorator(contextPropagatingDecorator);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }

  private static void restore(Map<String, String> context) {
    if (context != null) {
      MDC.setContextMap(context);
    } else {
      MDC.clear();
    }
  }
}
