package my.portfolioengine.app.domain;

public class CurrencyMismatchException extends IllegalArgumentException {
	private final String expected;
	private final String actual;

	public CurrencyMismatchException(String operation, String expected, String actual) {
		super("Cannot " + operation + " different currencies: " + expected + " and " + actual);
		this.expected = expected;
		this.actual = actual;
	}

	public String getExpected() {
		return expected;
	}

	public String getActual() {
		return actual;
	}
}
