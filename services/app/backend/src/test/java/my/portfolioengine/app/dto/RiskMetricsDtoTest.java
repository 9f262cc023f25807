package my.portfolioengine.app.dto;

import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import static org.assertj.core.api.Assertions.assertThat;

class RiskMetricsDtoTest {
	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void serializesMetricNamesInSnakeCase() {
		RiskMetricsDto metrics = new RiskMetricsDto(8.9d, 10.0d, -1.0d, 11.55d, 183.3d, 0.0d, 4.58d, 0.0d,
				10.0d, 0.89d, 95.0d, -8.0d, -10.0d, 66.67d, 10.0d, -10.0d, -1.73d, 0.0d);

		JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(metrics));

		assertThat(json.get("total_return_pct").asDouble()).isEqualTo(8.9d);
		assertThat(json.get("annualized_volatility_pct").asDouble()).isEqualTo(183.3d);
		assertThat(json.get("max_dd_pct").asDouble()).isEqualTo(10.0d);
		assertThat(json.get("var_daily_pct").asDouble()).isEqualTo(-8.0d);
		assertThat(json.get("cvar_daily_pct").asDouble()).isEqualTo(-10.0d);
		assertThat(json.has("totalReturnPct")).isFalse();
	}
}
