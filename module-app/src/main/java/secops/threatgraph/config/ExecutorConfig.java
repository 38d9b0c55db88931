package secops.threatgraph.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import secops.threatgraph.core.loader.LoaderSettings;
import secops.threatgraph.core.loader.LoaderSupport;
import secops.threatgraph.global.executor.DefaultLogicExecutor;
import secops.threatgraph.global.executor.LogicExecutor;

/**
 * 실행 템플릿과 배치 조회 스레드 풀
 *
 * <ul>
 *   <li>logicExecutor: 모든 컴포넌트가 공유하는 예외 처리/타이머 템플릿
 *   <li>loaderFetchExecutor: 배치 함수 실행 전용 풀. 요청 스레드는 dispatch 결과만 기다립니다.
 *   <li>subscriptionNotifyExecutor: 구독 전달 리스너 실행 풀. 발행 스레드는 큐 적재까지만 합니다.
 * </ul>
 */
@Slf4j
@Configuration
public class ExecutorConfig {

  @Bean
  public LogicExecutor logicExecutor(MeterRegistry meterRegistry) {
    return new DefaultLogicExecutor(meterRegistry);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ThreadPoolTaskExecutor loaderFetchExecutor(LoaderProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getFetchThreads());
    executor.setMaxPoolSize(properties.getFetchThreads());
    executor.setQueueCapacity(1_000);
    executor.setThreadNamePrefix("loader-fetch-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    log.info("[ExecutorConfig] Loader fetch pool: threads={}", properties.getFetchThreads());
    return executor;
  }

  @Bean
  public ThreadPoolTaskExecutor subscriptionNotifyExecutor(SubscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getNotifyThreads());
    executor.setMaxPoolSize(properties.getNotifyThreads());
    executor.setQueueCapacity(properties.getNotifyQueueCapacity());
    executor.setThreadNamePrefix("subscription-notify-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    log.info(
        "[ExecutorConfig] Subscription notify pool: threads={}, queueCapacity={}",
        properties.getNotifyThreads(),
        properties.getNotifyQueueCapacity());
    return executor;
  }

  @Bean
  public LoaderSupport loaderSupport(
      LogicExecutor logicExecutor,
      MeterRegistry meterRegistry,
      @Qualifier("loaderFetchExecutor") ThreadPoolTaskExecutor loaderFetchExecutor) {
    return new LoaderSupport(logicExecutor, meterRegistry, loaderFetchExecutor);
  }

  @Bean
  public LoaderSettings loaderSettings(LoaderProperties properties) {
    return properties.toSettings();
  }
}
