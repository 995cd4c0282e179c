package io.github.archlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("LinkHeaderPagination Tests")
@ExtendWith(MockitoExtension.class)
class LinkHeaderPaginationTest {

	private static final String URL = "https://gitlab.example.org/api/v4/projects/p/repository/tags";

	@Mock
	private ApiClient mockClient;

	private final ObjectMapper mapper = ObjectMapperFactory.create();

	private static ApiResponse withNext(String body, String next) {
		return new ApiResponse(200, body, Map.of("Link", List.of("<" + next + ">; rel=\"next\"")));
	}

	private static ApiResponse lastPage(String body) {
		return new ApiResponse(200, body, Map.of("Link", List.of("<" + URL + "?page=1>; rel=\"first\"")));
	}

	@Test
	@DisplayName("Should follow next links and concatenate pages in order")
	void shouldFollowNextLinks() throws Exception {
		when(mockClient.get(URL + "?per_page=2&page=1")).thenReturn(withNext("[{\"n\":1},{\"n\":2}]", URL + "?p2"));
		when(mockClient.get(URL + "?p2")).thenReturn(lastPage("[{\"n\":3}]"));

		List<JsonNode> items = new LinkHeaderPagination(mockClient, mapper, 8).fetchAll(URL, 2);

		assertThat(items).extracting(node -> node.get("n").asInt()).containsExactly(1, 2, 3);
	}

	@Test
	@DisplayName("Should stop on short page without link header")
	void shouldStopOnShortPage() throws Exception {
		when(mockClient.get(URL + "?per_page=2&page=1")).thenReturn(ApiResponse.ok("[{\"n\":1},{\"n\":2}]"));
		when(mockClient.get(URL + "?per_page=2&page=2")).thenReturn(ApiResponse.ok("[{\"n\":3}]"));

		List<JsonNode> items = new LinkHeaderPagination(mockClient, mapper, 8).fetchAll(URL, 2);

		assertThat(items).hasSize(3);
		verify(mockClient, times(2)).get(anyString());
	}

	@Test
	@DisplayName("Should stop after max pages")
	void shouldStopAfterMaxPages() throws Exception {
		when(mockClient.get(anyString())).thenReturn(ApiResponse.ok("[{\"n\":1}]"));

		List<JsonNode> items = new LinkHeaderPagination(mockClient, mapper, 3).fetchAll(URL, 1);

		assertThat(items).hasSize(3);
		verify(mockClient, times(3)).get(anyString());
	}

	@Test
	@DisplayName("Should append paging parameters to existing query")
	void shouldBuildPageUrl() {
		assertThat(LinkHeaderPagination.pageUrl("https://x/tags?order_by=updated", 100, 2))
			.isEqualTo("https://x/tags?order_by=updated&per_page=100&page=2");
	}

}
