package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record IndexCloseDto(
		@JsonProperty("date") LocalDate date,
		@JsonProperty("closeIndex") Double closeIndex
) {
}
