package my.portfolioengine.app.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals of solver outcomes. Safe to share between threads.
 */
@Component
public class OptimizerStatistics {
	private final AtomicLong successCount = new AtomicLong();
	private final AtomicLong fallbackCount = new AtomicLong();
	private final AtomicLong solveMillis = new AtomicLong();

	public void record(SolverMetrics metrics) {
		if (metrics == null) {
			return;
		}
		if (metrics.usedFallback()) {
			fallbackCount.incrementAndGet();
		} else {
			successCount.incrementAndGet();
		}
		solveMillis.addAndGet(metrics.elapsedMillis());
	}

	public Snapshot snapshot() {
		return new Snapshot(successCount.get(), fallbackCount.get(), solveMillis.get());
	}

	public record Snapshot(long successCount, long fallbackCount, long totalSolveMillis) {
		public long total() {
			return successCount + fallbackCount;
		}
	}
}
