package com.swapengine.worker.config;

import com.swapengine.domain.routing.PriceSource;
import com.swapengine.domain.routing.QuoteAggregator;
import com.swapengine.domain.routing.RouteSelector;
import com.swapengine.domain.routing.SwapExecutor;
import com.swapengine.integration.dex.SimulatedDexPriceSource;
import com.swapengine.integration.dex.SimulatedDexProperties;
import com.swapengine.integration.dex.SimulatedSwapExecutor;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.random.RandomGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  RoutingProperties.class,
  SimulatedDexProperties.class,
  NotificationProperties.class
})
public class RoutingConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock workerClock() {
    return Clock.systemUTC();
  }

  // java.util.Random is safe to share across the quote threads.
  @Bean
  @ConditionalOnMissingBean
  public RandomGenerator dexRandom() {
    return new Random();
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService quoteExecutor(RoutingProperties properties) {
    int poolSize = Math.max(1, properties.getQuotePoolSize());
    AtomicInteger sequence = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "quote-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(poolSize, threadFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public QuoteAggregator quoteAggregator(
      SimulatedDexProperties dexProperties,
      RoutingProperties routingProperties,
      RandomGenerator dexRandom,
      ExecutorService quoteExecutor) {
    List<PriceSource> sources = new ArrayList<>();
    for (SimulatedDexProperties.Venue venue : dexProperties.getVenues()) {
      sources.add(new SimulatedDexPriceSource(venue, dexProperties, dexRandom));
    }
    return new QuoteAggregator(sources, quoteExecutor, routingProperties.getQuoteTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public RouteSelector routeSelector(
      RoutingProperties routingProperties, QuoteAggregator quoteAggregator) {
    List<String> priority = routingProperties.getSourcePriority();
    if (priority == null || priority.isEmpty()) {
      priority = quoteAggregator.sourceNames();
    }
    return new RouteSelector(priority);
  }

  @Bean
  @ConditionalOnMissingBean
  public SwapExecutor swapExecutor(SimulatedDexProperties dexProperties, RandomGenerator dexRandom) {
    return new SimulatedSwapExecutor(dexProperties, dexRandom);
  }
}
