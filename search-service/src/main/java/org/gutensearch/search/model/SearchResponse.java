package org.gutensearch.search.model;

import java.util.List;
import java.util.Map;

public record SearchResponse(
		String query,
		Map<String, Object> filters,
		int count,
		List<SearchResult> results
) {}
