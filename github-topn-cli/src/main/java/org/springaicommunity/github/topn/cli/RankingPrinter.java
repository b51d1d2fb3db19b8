package org.springaicommunity.github.topn.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springaicommunity.github.topn.RankedRepository;
import org.springaicommunity.github.topn.RankedResult;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Renders a {@link RankedResult} as text lines or as a JSON document.
 */
public class RankingPrinter {

	private final ObjectMapper objectMapper;

	public RankingPrinter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Print one line per repository, showing the ranked metric.
	 * @param result ranking to print
	 * @param out destination
	 */
	public void printText(RankedResult result, PrintStream out) {
		List<RankedRepository> repositories = result.repositories();
		for (int i = 0; i < repositories.size(); i++) {
			out.println(formatLine(i + 1, repositories.get(i), result));
		}
	}

	/**
	 * Print the ranking as a JSON document.
	 * @param result ranking to print
	 * @param out destination
	 */
	public void printJson(RankedResult result, PrintStream out) {
		try {
			out.println(objectMapper.writeValueAsString(toReport(result)));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render ranking as JSON", e);
		}
	}

	String formatLine(int rank, RankedRepository repository, RankedResult result) {
		String prefix = String.format("%d) repo: \"%s\", ", rank, repository.name());
		return switch (result.metric()) {
			case STARS -> prefix + "stars: " + repository.stars();
			case FORKS -> prefix + "forks: " + repository.forks();
			case PRS -> prefix + "pull requests: " + repository.pullRequests().orElse(0);
			case CONTRIBS -> prefix + String.format(Locale.ROOT, "contribution percentage: %.2f%%",
					repository.contributionRatio().orElse(0) * 100);
		};
	}

	Report toReport(RankedResult result) {
		List<Row> rows = new ArrayList<>();
		List<RankedRepository> repositories = result.repositories();
		for (int i = 0; i < repositories.size(); i++) {
			RankedRepository repository = repositories.get(i);
			rows.add(new Row(i + 1, repository.name(), repository.stars(), repository.forks(),
					repository.pullRequests(), repository.contributionRatio()));
		}
		return new Report(result.organization(), result.metric().key(), result.strategy().key(), rows);
	}

	record Report(String organization, String metric, String strategy, List<Row> repositories) {
	}

	record Row(int rank, String name, int stars, int forks, OptionalInt pullRequests,
			OptionalDouble contributionRatio) {
	}

}
