package io.github.archlog;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link ApiClient} - HTTP GET against a hosting platform</li>
 * <li>{@link CommandRunner} - Local package manager commands</li>
 * <li>{@link Sleeper} - Waiting between retry attempts</li>
 * </ul>
 *
 * <h3>Implementations</h3>
 * <ul>
 * <li>{@link HttpApiClient} - JDK HTTP client implementation</li>
 * <li>{@link RetryingApiClient} - Retry decorator driven by a {@link RetryPolicy}</li>
 * <li>{@link ProcessCommandRunner} - Process based command runner</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Platform services and resolvers → ApiClient (NOT HttpApiClient)
 *   Package manager client → CommandRunner (NOT ProcessCommandRunner)
 *   Only ArchlogBuilder wires concrete implementations
 * </pre>
 */
@AnalyzeClasses(packages = "io.github.archlog", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule platform_services_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Api")
		.or()
		.haveSimpleNameEndingWith("Resolver")
		.or()
		.haveSimpleNameEndingWith("Fetcher")
		.or()
		.haveSimpleNameEndingWith("Service")
		.or()
		.haveSimpleName("WebScraper")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("HttpApiClient")
		.because("Services should depend on the ApiClient interface, not the concrete HttpApiClient");

	@ArchTest
	static final ArchRule pacman_client_should_depend_on_runner_interface = noClasses().that()
		.haveSimpleName("PacmanClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("ProcessCommandRunner")
		.because("PacmanClient should depend on the CommandRunner interface");

	@ArchTest
	static final ArchRule services_should_not_depend_on_retry_decorator = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.or()
		.haveSimpleNameEndingWith("Api")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("RetryingApiClient")
		.because("Retries are configured once in ArchlogBuilder");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule api_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("ApiClient")
		.and()
		.areNotInterfaces()
		.should()
		.implement(ApiClient.class)
		.because("All API client implementations should implement the ApiClient interface");

	@ArchTest
	static final ArchRule command_runners_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("CommandRunner")
		.and()
		.areNotInterfaces()
		.should()
		.implement(CommandRunner.class);

	// ========== Framework Rules ==========

	@ArchTest
	static final ArchRule core_should_not_depend_on_logging_backend = noClasses().should()
		.dependOnClassesThat()
		.resideInAPackage("ch.qos.logback..")
		.because("The core library logs through the SLF4J API only");

}
