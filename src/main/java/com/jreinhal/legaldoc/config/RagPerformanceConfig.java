package com.jreinhal.legaldoc.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for the pipeline.
 *
 * <ul>
 *   <li>{@code stageExecutor} hosts each pipeline stage so the orchestrator can bound it with a timeout.</li>
 *   <li>{@code ragExecutor} runs the sparse and dense lookups of one retrieval side by side.</li>
 *   <li>{@code rerankerExecutor} scores candidate passages in parallel.</li>
 *   <li>{@code pipelineExecutor} runs whole queries submitted asynchronously.</li>
 * </ul>
 *
 * <p>The pools are separate so that a stage task never waits on a slot in its own pool.
 * Rejections are logged and rethrown rather than run on the caller thread.</p>
 */
@Configuration
public class RagPerformanceConfig {

    private static final Logger log = LoggerFactory.getLogger(RagPerformanceConfig.class);
    private static final long KEEP_ALIVE_SECONDS = 30L;
    private static final int MIN_QUEUE = 10;

    @Bean(name = {"ragExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor ragExecutor(
            @Value("${legaldoc.performance.rag-core-threads:4}") int coreThreads,
            @Value("${legaldoc.performance.rag-max-threads:8}") int maxThreads,
            @Value("${legaldoc.performance.rag-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("rag-exec-", coreThreads, maxThreads, queueCapacity);
    }

    @Bean(name = {"rerankerExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor rerankerExecutor(
            @Value("${legaldoc.performance.reranker-threads:4}") int threads) {
        // one query scores up to top-m passages at once
        return this.buildExecutor("rerank-exec-", threads, threads, threads * 10);
    }

    @Bean(name = {"stageExecutor"}, destroyMethod = "shutdownNow")
    public ThreadPoolExecutor stageExecutor(
            @Value("${legaldoc.performance.stage-threads:8}") int threads,
            @Value("${legaldoc.performance.stage-queue-capacity:100}") int queueCapacity) {
        // timed-out stages keep their thread until they notice the interrupt
        return this.buildExecutor("stage-exec-", threads, threads * 2, queueCapacity);
    }

    @Bean(name = {"pipelineExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor pipelineExecutor(
            @Value("${legaldoc.performance.pipeline-threads:4}") int threads,
            @Value("${legaldoc.performance.pipeline-queue-capacity:100}") int queueCapacity) {
        return this.buildExecutor("pipeline-exec-", threads, threads, queueCapacity);
    }

    private ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(MIN_QUEUE, queueCapacity);
        AtomicInteger threadCounter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, prefix + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), threadFactory, new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Pool {} ready: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    /**
     * Counts and rethrows rejections. A rejected query surfaces as HTTP 503 through
     * {@link com.jreinhal.legaldoc.exception.GlobalExceptionHandler}; a rejected stage fails that stage.
     */
    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong();

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            long rejected = this.rejectionCount.incrementAndGet();
            if (rejected == 1L || rejected % 100L == 0L) {
                log.warn("Pool {} saturated: active={}, queued={}, rejected so far={}", this.poolName,
                        executor.getActiveCount(), executor.getQueue().size(), rejected);
            }
            throw new RejectedExecutionException("Pool " + this.poolName + " is saturated");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }
}
