package io.github.archlog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Wires the changelog engine without a dependency injection container.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * // Defaults, tokens from .env or the environment
 * ChangelogService service = ArchlogBuilder.create()
 *     .tokensFromEnv()
 *     .buildChangelogService();
 *
 * // With loaded configuration
 * ArchlogProperties props = new ConfigurationLoader(ObjectMapperFactory.create()).load(configFile);
 * ChangelogService service = ArchlogBuilder.create()
 *     .properties(props)
 *     .buildChangelogService();
 *
 * // For testing with mock clients
 * ChangelogService service = ArchlogBuilder.create()
 *     .gitHubClient(mockGitHub)
 *     .gitLabClient(mockGitLab)
 *     .archLinuxClient(mockArch)
 *     .webClient(mockWeb)
 *     .commandRunner(mockRunner)
 *     .buildChangelogService();
 * }
 * </pre>
 *
 * <p>
 * One HTTP client per platform is created on the first build call and shared by every
 * component built afterwards.
 */
public class ArchlogBuilder {

	private ArchlogProperties properties = new ArchlogProperties();

	private String gitHubToken = "";

	private String gitLabToken = "";

	private @Nullable ObjectMapper objectMapper;

	private @Nullable ApiClient gitHubClient;

	private @Nullable ApiClient gitLabClient;

	private @Nullable ApiClient archLinuxClient;

	private @Nullable ApiClient webClient;

	private @Nullable CommandRunner commandRunner;

	private Sleeper sleeper = Sleeper.THREAD;

	private @Nullable Components components;

	private ArchlogBuilder() {
	}

	/**
	 * Create a new builder instance.
	 * @return new ArchlogBuilder
	 */
	public static ArchlogBuilder create() {
		return new ArchlogBuilder();
	}

	/**
	 * Set properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ArchlogBuilder properties(@Nullable ArchlogProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Read {@code GITHUB_TOKEN} and {@code GITLAB_TOKEN} from {@code .env} or the
	 * environment. Both are optional and only raise rate limits.
	 * @return this builder
	 */
	public ArchlogBuilder tokensFromEnv() {
		this.gitHubToken = EnvironmentSupport.token(EnvironmentSupport.GITHUB_TOKEN);
		this.gitLabToken = EnvironmentSupport.token(EnvironmentSupport.GITLAB_TOKEN);
		return this;
	}

	public ArchlogBuilder gitHubToken(String token) {
		this.gitHubToken = token;
		return this;
	}

	public ArchlogBuilder gitLabToken(String token) {
		this.gitLabToken = token;
		return this;
	}

	public ArchlogBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the client for {@code api.github.com}. A custom client is used as is, without
	 * an extra retry decorator.
	 * @param client custom client (null to use default)
	 * @return this builder
	 */
	public ArchlogBuilder gitHubClient(@Nullable ApiClient client) {
		this.gitHubClient = client;
		return this;
	}

	/**
	 * Set the client for GitLab instances ({@code gitlab.archlinux.org},
	 * {@code invent.kde.org} and others).
	 * @param client custom client (null to use default)
	 * @return this builder
	 */
	public ArchlogBuilder gitLabClient(@Nullable ApiClient client) {
		this.gitLabClient = client;
		return this;
	}

	public ArchlogBuilder archLinuxClient(@Nullable ApiClient client) {
		this.archLinuxClient = client;
		return this;
	}

	/**
	 * Set the client for plain web pages.
	 * @param client custom client (null to use default)
	 * @return this builder
	 */
	public ArchlogBuilder webClient(@Nullable ApiClient client) {
		this.webClient = client;
		return this;
	}

	public ArchlogBuilder commandRunner(@Nullable CommandRunner commandRunner) {
		this.commandRunner = commandRunner;
		return this;
	}

	/**
	 * Set the sleeper used between retry attempts of the default clients.
	 * @param sleeper sleeper
	 * @return this builder
	 */
	public ArchlogBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Build the changelog aggregator.
	 * @return configured ChangelogService
	 */
	public ChangelogService buildChangelogService() {
		Components components = buildComponents();
		return new ChangelogService(components.pacmanClient(), components.archLinuxApi(), components.gitLabApi(),
				new NvcheckerConfigParser(ObjectMapperFactory.createToml()), components.sourceResolver(),
				components.tagIndexBuilder(), components.tagWalker(), properties.getEnabledRepositories());
	}

	/**
	 * Build the package manager client.
	 * @return configured PacmanClient
	 */
	public PacmanClient buildPacmanClient() {
		return buildComponents().pacmanClient();
	}

	/**
	 * Build the changelog writer.
	 * @return configured ChangelogWriter
	 */
	public ChangelogWriter buildChangelogWriter() {
		return new ChangelogWriter(mapper());
	}

	private Components buildComponents() {
		if (this.components == null) {
			this.components = createComponents();
		}
		return this.components;
	}

	private Components createComponents() {
		ObjectMapper mapper = mapper();

		ApiClient gitHub = this.gitHubClient != null ? this.gitHubClient
				: retrying(HttpApiClient.forGitHub(properties.getRequestTimeout(), gitHubToken),
						RetryPolicy.rateLimited());
		ApiClient gitLab = this.gitLabClient != null ? this.gitLabClient
				: retrying(HttpApiClient.forGitLab(properties.getRequestTimeout(), gitLabToken),
						RetryPolicy.standard());
		ApiClient archLinux = this.archLinuxClient != null ? this.archLinuxClient
				: retrying(new HttpApiClient(properties.getRequestTimeout()), RetryPolicy.standard());
		ApiClient web = this.webClient != null ? this.webClient
				: retrying(new HttpApiClient(properties.getRequestTimeout()),
						RetryPolicy.fixedDelay(properties.getWebscraperDelay()));
		CommandRunner runner = this.commandRunner != null ? this.commandRunner : new ProcessCommandRunner();

		GitHubApi gitHubApi = new GitHubApi(gitHub, mapper);
		GitLabApi gitLabApi = new GitLabApi(gitLab, mapper, properties.getMaxGitLabPages());
		ArchLinuxApi archLinuxApi = new ArchLinuxApi(archLinux, mapper);
		WebScraper webScraper = new WebScraper(web);

		UpstreamSourceResolver sourceResolver = new UpstreamSourceResolver(
				new KdeCategoryResolver(gitLabApi, webScraper));
		TagIndexBuilder tagIndexBuilder = new TagIndexBuilder(gitLabApi, gitHubApi);
		PackagingChangelogFetcher packagingFetcher = new PackagingChangelogFetcher(gitLabApi);
		UpstreamChangelogFetcher upstreamFetcher = new UpstreamChangelogFetcher(tagIndexBuilder,
				new FuzzyTagMatcher(properties.getFuzzyMatchThreshold()), gitHubApi, gitLabApi, packagingFetcher,
				new RecipeSourceExtractor(properties.getUrlSimilarityThreshold()), sourceResolver, webScraper);
		IntermediateTagWalker tagWalker = new IntermediateTagWalker(packagingFetcher, upstreamFetcher);

		return new Components(new PacmanClient(runner, properties.getArchitectureWording()), archLinuxApi, gitLabApi,
				sourceResolver, tagIndexBuilder, tagWalker);
	}

	private ApiClient retrying(ApiClient client, RetryPolicy policy) {
		return RetryingApiClient.builder()
			.wrapping(client)
			.policy(policy)
			.maxAttempts(properties.getMaxAttempts())
			.backoffFactor(properties.getBackoffFactor())
			.sleeper(sleeper)
			.build();
	}

	private ObjectMapper mapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(PacmanClient pacmanClient, ArchLinuxApi archLinuxApi, GitLabApi gitLabApi,
			UpstreamSourceResolver sourceResolver, TagIndexBuilder tagIndexBuilder, IntermediateTagWalker tagWalker) {
	}

}
