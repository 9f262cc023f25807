package my.portfolioengine.app.service;

import java.util.List;

/**
 * Source of the symbols eligible for a given calendar month.
 */
public interface UniverseProvider {
	List<String> symbolsFor(int year, int month);
}
