package my.portfolioengine.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class OptimizerConfig {
	private static final int SOLVER_THREADS = 2;

	@Bean(name = "solverExecutor", destroyMethod = "shutdownNow")
	public ExecutorService solverExecutor() {
		AtomicInteger counter = new AtomicInteger();
		ThreadFactory threadFactory = runnable -> {
			Thread thread = new Thread(runnable, "qp-solver-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
		return Executors.newFixedThreadPool(SOLVER_THREADS, threadFactory);
	}
}
