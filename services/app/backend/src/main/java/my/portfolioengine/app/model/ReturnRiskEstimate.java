package my.portfolioengine.app.model;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Expected-return vector {@code mu} and covariance matrix {@code Q}, both free of NaN and infinities.
 */
public record ReturnRiskEstimate(
		RealVector expectedReturns,
		RealMatrix covariance
) {
	public int assetCount() {
		return expectedReturns.getDimension();
	}
}
