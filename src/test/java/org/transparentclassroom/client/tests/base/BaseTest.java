package org.transparentclassroom.client.tests.base;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.matching.UrlPattern;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.transparentclassroom.client.rest.TransparentClassroomClient;
import org.transparentclassroom.client.rest.config.ClientSettings;

import java.io.IOException;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

/**
 * Simple base test class serving static JSON responses from files.
 *
 * Tests verify:
 * 1. Client forms correct HTTP request (using WireMock.verify())
 * 2. Client maps the static response correctly
 */
public abstract class BaseTest {

    protected static final String API_TOKEN = "TEST_API_TOKEN";

    protected static WireMockServer wireMockServer;

    /**
     * Returns the test resource directory name (e.g., "TransparentClassroomClientTest")
     */
    protected abstract String getTestResourceDirectory();

    @BeforeEach
    public void setupWireMock() {
        if (wireMockServer == null) {
            wireMockServer = new WireMockServer(
                WireMockConfiguration.wireMockConfig().dynamicPort()
            );
            wireMockServer.start();
            System.out.println("[BaseTest] WireMock server started on port: " + wireMockServer.port());
        }
        // Reset WireMock before each test to ensure isolation
        configureFor("localhost", wireMockServer.port());
        wireMockServer.resetAll();
    }

    /**
     * Setup a static JSON response for a GET endpoint
     * @param endpoint REST endpoint with query (e.g., "/api/v1/children.json?page=1")
     * @param responseFile JSON file name in test resources (e.g., "children.json")
     */
    protected void setupStaticJsonResponse(String endpoint, String responseFile) throws IOException {
        setupStaticJsonResponse(urlEqualTo(endpoint), responseFile);
    }

    protected void setupStaticJsonResponse(UrlPattern urlPattern, String responseFile) throws IOException {
        String responseBody = loadStaticResponse(responseFile);

        wireMockServer.stubFor(get(urlPattern)
            .willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody(responseBody)));

        System.out.println("[BaseTest] Configured static JSON response for endpoint: " + urlPattern.toString() +
            " from file: " + responseFile);
    }

    /**
     * Setup the authentication endpoint to hand out {@link #API_TOKEN}
     */
    protected void setupAuthentication() throws IOException {
        setupStaticJsonResponse("/api/v1/authenticate.json", "authenticate.json");
    }

    /**
     * Load static response file from test resources
     */
    protected String loadStaticResponse(String responseFile) throws IOException {
        return JsonFixtures.read(getTestResourceDirectory(), responseFile);
    }

    /**
     * Settings pointing the client at WireMock. Override to customize.
     */
    protected ClientSettings getClientSettings() {
        ClientSettings settings = new ClientSettings();
        settings.setHost("http://localhost:" + wireMockServer.port());
        settings.setEmail("admin@school.org");
        settings.setPassword("secret");
        return settings;
    }

    protected TransparentClassroomClient createClient() {
        return new TransparentClassroomClient(getClientSettings());
    }

    @AfterAll
    public static void tearDownWiremock() {
        if (wireMockServer != null) {
            wireMockServer.stop();
            System.out.println("[BaseTest] WireMock server stopped");
            wireMockServer = null;
        }
    }

    protected WireMockServer getWireMockServer() {
        return wireMockServer;
    }
}
