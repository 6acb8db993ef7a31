package com.chicu.breachml.ml;

import com.chicu.breachml.risk.EntityHistoryProvider;
import com.chicu.breachml.risk.NoopEntityHistoryProvider;
import com.chicu.breachml.risk.NoopPortfolioDirectory;
import com.chicu.breachml.risk.PortfolioDirectory;
import com.chicu.breachml.risk.StatisticalRiskScorer;
import com.chicu.breachml.risk.UnavailableRiskScorer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(MlProperties.class)
public class MlConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Пул для predict с таймаутом: зависший бэкенд не держит поток вызывающего.
     */
    @Bean(name = "mlInferenceExecutor", destroyMethod = "shutdownNow")
    public ExecutorService mlInferenceExecutor(MlProperties props) {
        return Executors.newFixedThreadPool(
                Math.max(1, props.getInference().getWorkerThreads()),
                named("ml-inference")
        );
    }

    /**
     * Отдельный пул обучения: длинные прогоны не конкурируют с инференсом.
     */
    @Bean(name = "mlTrainingExecutor", destroyMethod = "shutdownNow")
    public ExecutorService mlTrainingExecutor(MlProperties props) {
        return Executors.newFixedThreadPool(
                Math.max(1, props.getTraining().getWorkerThreads()),
                named("ml-training")
        );
    }

    // ===== внешние порты: заглушки, пока реальные реализации не подключены =====

    @Bean
    @ConditionalOnMissingBean
    public StatisticalRiskScorer statisticalRiskScorer() {
        return new UnavailableRiskScorer();
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityHistoryProvider entityHistoryProvider() {
        return new NoopEntityHistoryProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public PortfolioDirectory portfolioDirectory() {
        return new NoopPortfolioDirectory();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
