package eu.fbk.sciencesource.client;

import java.io.IOException;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;
import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import javax.ws.rs.HttpMethod;
import javax.ws.rs.ProcessingException;
import javax.ws.rs.client.ClientBuilder;
import javax.ws.rs.client.Entity;
import javax.ws.rs.client.Invocation;
import javax.ws.rs.client.WebTarget;
import javax.ws.rs.core.Form;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.net.HttpHeaders;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.conn.HttpClientConnectionManager;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.conn.ssl.DefaultHostnameVerifier;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.glassfish.jersey.apache.connector.ApacheClientProperties;
import org.glassfish.jersey.apache.connector.ApacheConnectorProvider;
import org.glassfish.jersey.client.ClientConfig;
import org.glassfish.jersey.client.ClientProperties;
import org.glassfish.jersey.client.RequestEntityProcessing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.sciencesource.ScienceSource;
import eu.fbk.sciencesource.ScienceSourceException;
import eu.fbk.sciencesource.internal.Util;

/**
 * A {@code ScienceSource} talking to the MediaWiki action API ({@code api.php}) of a Wikibase
 * instance.
 * <p>
 * Instances are created via {@link #builder(String)}. When credentials are supplied, the client
 * logs in with them (bot password) before its first call and keeps the session cookies for all
 * later calls; write calls carry a CSRF token fetched once and refreshed if rejected. Instances
 * are thread safe and must be closed to release their pooled connections.
 * </p>
 */
public final class Client implements ScienceSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(Client.class);

    private static final String USER_AGENT = String.format(
            "ScienceSource/%s Apache-HttpClient/%s",
            Util.getVersion("eu.fbk.sciencesource", "ss-client", "devel"),
            Util.getVersion("org.apache.httpcomponents", "httpclient", "unknown"));

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String[] HTTPS_PROTOCOLS = new String[] { "TLSv1.2" };

    private static final int DEFAULT_MAX_CONNECTIONS = 2;

    private static final boolean DEFAULT_VALIDATE_SERVER = true;

    private static final int DEFAULT_CONNECTION_TIMEOUT = 10000; // 10 sec

    private static final int SOCKET_TIMEOUT = 60000;

    private static final String DEFAULT_LANGUAGE = "en";

    private static final int SEARCH_LIMIT = 50;

    private final String apiURL;

    @Nullable
    private final String username;

    @Nullable
    private final String password;

    private final String language;

    private final HttpClientConnectionManager connectionManager;

    private final javax.ws.rs.client.Client client;

    private boolean loggedIn;

    @Nullable
    private String csrfToken;

    private boolean closed;

    private Client(final Builder builder) {

        final String url = Preconditions.checkNotNull(builder.apiURL).trim();
        Preconditions.checkArgument(url.startsWith("http://") || url.startsWith("https://"),
                "Not an HTTP(S) URL: %s", url);
        Preconditions.checkArgument(builder.username == null || builder.password != null,
                "No password for user %s", builder.username);

        final int timeout;
        timeout = MoreObjects.firstNonNull(builder.connectionTimeout, DEFAULT_CONNECTION_TIMEOUT);
        Preconditions.checkArgument(timeout >= 0, "Invalid connection timeout %s", timeout);
        final int maxConnections = MoreObjects.firstNonNull(builder.maxConnections,
                DEFAULT_MAX_CONNECTIONS);
        Preconditions.checkArgument(maxConnections > 0, "Invalid max connections %s",
                maxConnections);

        this.apiURL = url;
        this.username = builder.username;
        this.password = builder.password;
        this.language = MoreObjects.firstNonNull(builder.language, DEFAULT_LANGUAGE);
        this.connectionManager = createConnectionManager(maxConnections,
                MoreObjects.firstNonNull(builder.validateServer, DEFAULT_VALIDATE_SERVER));
        this.client = createJaxrsClient(this.connectionManager, timeout, builder.proxy);
        this.loggedIn = this.username == null;
        this.csrfToken = null;
        this.closed = false;
    }

    public String getAPIURL() {
        return this.apiURL;
    }

    @Nullable
    public String getUsername() {
        return this.username;
    }

    public String getLanguage() {
        return this.language;
    }

    @Override
    public String resolvePropertyLabel(final String label) throws ScienceSourceException {
        return searchEntity("property", label);
    }

    @Override
    public String resolveItemLabel(final String label) throws ScienceSourceException {
        return searchEntity("item", label);
    }

    @Override
    public int createArticle(final String title, final String content)
            throws ScienceSourceException {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(title), "Empty page title");
        final Form form = new Form();
        form.param("action", "edit");
        form.param("title", title);
        form.param("text", content);
        form.param("createonly", "1");
        form.param("contentmodel", "wikitext");
        form.param("summary", "Upload of article text");
        final JsonNode edit = write(form).path("edit");
        if (!"Success".equals(edit.path("result").asText())) {
            throw new ScienceSourceException("edit-failed", "Creation of page '" + title
                    + "' failed: " + edit, null);
        }
        final int pageID = edit.path("pageid").asInt();
        if (pageID <= 0) {
            throw new ScienceSourceException("edit-failed", "No page ID returned for '" + title
                    + "': " + edit, null);
        }
        return pageID;
    }

    @Override
    public String createItem(final String itemTypeID, final Map<String, Object> properties)
            throws ScienceSourceException {
        final Form form = new Form();
        form.param("action", "wbeditentity");
        form.param("new", "item");
        form.param("data", Claims.encode(properties).toString());
        form.param("summary", "Creation of " + itemTypeID + " item");
        final String id = write(form).path("entity").path("id").asText();
        if (Strings.isNullOrEmpty(id)) {
            throw new ScienceSourceException("edit-failed", "No item ID returned for new "
                    + itemTypeID + " item", null);
        }
        return id;
    }

    @Override
    public void updateItem(final String itemID, final Map<String, Object> properties)
            throws ScienceSourceException {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(itemID), "Empty item ID");
        if (properties.isEmpty()) {
            return;
        }
        final Form form = new Form();
        form.param("action", "wbeditentity");
        form.param("id", itemID);
        form.param("data", Claims.encode(properties).toString());
        form.param("summary", "Update of item " + itemID);
        write(form);
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        try {
            this.client.close();
        } finally {
            this.connectionManager.shutdown();
        }
        LOGGER.debug("{} closed", this);
    }

    private String searchEntity(final String type, final String label)
            throws ScienceSourceException {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(label), "Empty label");
        final Form form = new Form();
        form.param("action", "wbsearchentities");
        form.param("search", label);
        form.param("language", this.language);
        form.param("type", type);
        form.param("limit", Integer.toString(SEARCH_LIMIT));
        login();
        final String id = findEntity(invoke(HttpMethod.GET, form), label);
        if (id == null) {
            throw new ScienceSourceException("not-found", "No " + type + " labelled '" + label
                    + "'", null);
        }
        return id;
    }

    private JsonNode write(final Form form) throws ScienceSourceException {
        login();
        String token = csrfToken(false);
        form.param("token", token);
        form.param("bot", "1");
        try {
            return invoke(HttpMethod.POST, form);
        } catch (final ScienceSourceException ex) {
            if (!"badtoken".equals(ex.getCode())) {
                throw ex;
            }
            LOGGER.debug("CSRF token rejected, fetching a new one");
            token = csrfToken(true);
            form.asMap().putSingle("token", token);
            return invoke(HttpMethod.POST, form);
        }
    }

    private synchronized void login() throws ScienceSourceException {
        checkNotClosed();
        if (this.loggedIn) {
            return;
        }
        final Form tokenForm = new Form();
        tokenForm.param("action", "query");
        tokenForm.param("meta", "tokens");
        tokenForm.param("type", "login");
        final String loginToken = invoke(HttpMethod.GET, tokenForm).path("query")
                .path("tokens").path("logintoken").asText();

        final Form form = new Form();
        form.param("action", "login");
        form.param("lgname", this.username);
        form.param("lgpassword", this.password);
        form.param("lgtoken", loginToken);
        final JsonNode login = invoke(HttpMethod.POST, form).path("login");
        if (!"Success".equals(login.path("result").asText())) {
            throw new ScienceSourceException("login-failed", "Login of " + this.username
                    + " failed: " + login.path("reason").asText(login.path("result").asText()),
                    null);
        }
        this.loggedIn = true;
        LOGGER.info("Logged in to {} as {}", this.apiURL, this.username);
    }

    private synchronized String csrfToken(final boolean refresh) throws ScienceSourceException {
        if (this.csrfToken == null || refresh) {
            final Form form = new Form();
            form.param("action", "query");
            form.param("meta", "tokens");
            final String token = invoke(HttpMethod.GET, form).path("query").path("tokens")
                    .path("csrftoken").asText();
            if (Strings.isNullOrEmpty(token)) {
                throw new ScienceSourceException("badtoken", "No CSRF token returned", null);
            }
            this.csrfToken = token;
        }
        return this.csrfToken;
    }

    private JsonNode invoke(final String method, final Form form) throws ScienceSourceException {

        checkNotClosed();
        form.asMap().putSingle("format", "json");
        form.asMap().putSingle("formatversion", "2");

        // Create the invocation builder, placing parameters in the query string for GET
        WebTarget target = this.client.target(this.apiURL);
        if (HttpMethod.GET.equals(method)) {
            for (final Map.Entry<String, List<String>> entry : form.asMap().entrySet()) {
                target = target.queryParam(entry.getKey(), entry.getValue().toArray());
            }
        }
        final Invocation.Builder invoker = target.request(MediaType.APPLICATION_JSON_TYPE);
        invoker.header(HttpHeaders.USER_AGENT, USER_AGENT);

        // Log the request
        final String action = form.asMap().getFirst("action");
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Http: {} {} action={}", method, this.apiURL, action);
        }

        // Perform the request
        final long timestamp = System.currentTimeMillis();
        final Response response;
        try {
            response = HttpMethod.GET.equals(method) ? invoker.get() : invoker.post(Entity
                    .entity(form, MediaType.APPLICATION_FORM_URLENCODED_TYPE));
        } catch (final ProcessingException ex) {
            throw new ScienceSourceException("http", "Request " + action + " to " + this.apiURL
                    + " failed: " + ex.getMessage(), ex);
        }
        final long elapsed = System.currentTimeMillis() - timestamp;

        try {
            final int status = response.getStatus();
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Http: {}, {}, {} ms", status, response.getMediaType(), elapsed);
            }
            if (status / 100 != 2) {
                throw new ScienceSourceException("http-" + status, "Request " + action
                        + " failed with HTTP status " + status, null);
            }
            final String body = response.readEntity(String.class);
            final JsonNode json;
            try {
                json = MAPPER.readTree(body);
            } catch (final IOException ex) {
                throw new ScienceSourceException("invalid-response", "Malformed response to "
                        + action + ": " + ex.getMessage(), ex);
            }
            checkError(json);
            return json;
        } catch (final ProcessingException ex) {
            throw new ScienceSourceException("http", "Cannot read response to " + action + ": "
                    + ex.getMessage(), ex);
        } finally {
            Util.closeQuietly(response);
        }
    }

    private synchronized void checkNotClosed() {
        Preconditions.checkState(!this.closed, "Client closed");
    }

    /**
     * Throws a {@code ScienceSourceException} if the API response specified reports an error.
     */
    static void checkError(@Nullable final JsonNode json) throws ScienceSourceException {
        if (json == null || !json.isObject()) {
            throw new ScienceSourceException("invalid-response", "Unexpected response: "
                    + json, null);
        }
        final JsonNode error = json.get("error");
        if (error != null) {
            final String code = error.path("code").asText("unknown");
            final String info = error.path("info").asText(code);
            throw new ScienceSourceException(code, info, null);
        }
    }

    /**
     * Returns the ID of the first search result whose label matches exactly the label specified.
     */
    @Nullable
    static String findEntity(final JsonNode json, final String label) {
        for (final JsonNode result : json.path("search")) {
            if (label.equals(result.path("label").asText())) {
                final String id = result.path("id").asText();
                if (!id.isEmpty()) {
                    return id;
                }
            }
        }
        return null;
    }

    private static PoolingHttpClientConnectionManager createConnectionManager(
            final int maxConnections, final boolean validateServer) {

        // Setup SSLContext and HostnameVerifier based on validateServer parameter
        final SSLContext sslContext;
        HostnameVerifier hostVerifier;
        try {
            if (validateServer) {
                sslContext = SSLContext.getDefault();
                hostVerifier = new DefaultHostnameVerifier();
            } else {
                sslContext = SSLContext.getInstance(HTTPS_PROTOCOLS[0]);
                sslContext.init(null, new TrustManager[] { new X509TrustManager() {

                    @Override
                    public void checkClientTrusted(final X509Certificate[] chain,
                            final String authType) {
                    }

                    @Override
                    public void checkServerTrusted(final X509Certificate[] chain,
                            final String authType) {
                    }

                    @Override
                    public X509Certificate[] getAcceptedIssuers() {
                        return new X509Certificate[0];
                    }

                } }, null);
                hostVerifier = NoopHostnameVerifier.INSTANCE;
            }
        } catch (final Throwable ex) {
            throw new RuntimeException("SSL configuration failed", ex);
        }

        // Create HTTP and HTTPS connection factories
        final ConnectionSocketFactory httpConnectionFactory = PlainConnectionSocketFactory
                .getSocketFactory();
        final ConnectionSocketFactory httpsConnectionFactory = new SSLConnectionSocketFactory(
                sslContext, validateServer ? null : HTTPS_PROTOCOLS, null, hostVerifier);

        // Create pooled connection manager
        final PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager(
                RegistryBuilder.<ConnectionSocketFactory>create()
                        .register("http", httpConnectionFactory)
                        .register("https", httpsConnectionFactory).build());

        // Setup max concurrent connections
        manager.setMaxTotal(maxConnections);
        manager.setDefaultMaxPerRoute(maxConnections);
        manager.setValidateAfterInactivity(1000); // validate connection after 1s idle
        return manager;
    }

    private static javax.ws.rs.client.Client createJaxrsClient(
            final HttpClientConnectionManager connectionManager, final int connectionTimeout,
            @Nullable final ProxyConfig proxy) {

        // Configure requests
        final RequestConfig requestConfig = RequestConfig.custom() //
                .setExpectContinueEnabled(false) //
                .setRedirectsEnabled(false) //
                .setConnectionRequestTimeout(connectionTimeout) //
                .setConnectTimeout(connectionTimeout) //
                .setSocketTimeout(SOCKET_TIMEOUT) //
                .build();

        // Configure client; cookies carry the login session
        final ClientConfig config = new ClientConfig();
        config.connectorProvider(new ApacheConnectorProvider());
        config.property(ApacheClientProperties.CONNECTION_MANAGER, connectionManager);
        config.property(ApacheClientProperties.REQUEST_CONFIG, requestConfig);
        config.property(ApacheClientProperties.DISABLE_COOKIES, false);
        config.property(ClientProperties.REQUEST_ENTITY_PROCESSING,
                RequestEntityProcessing.BUFFERED);
        if (proxy != null) {
            config.property(ClientProperties.PROXY_URI, proxy.getURL());
            if (proxy.isAuthenticated()) {
                config.property(ClientProperties.PROXY_USERNAME, proxy.getUsername());
                config.property(ClientProperties.PROXY_PASSWORD, proxy.getPassword());
            }
            LOGGER.debug("Using proxy {}", proxy);
        }

        // Create and return a configured JAX-RS client
        return ClientBuilder.newClient(config);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("url", this.apiURL)
                .add("user", this.username).toString();
    }

    public static Builder builder(final String apiURL) {
        return new Builder(apiURL);
    }

    public static class Builder {

        String apiURL;

        @Nullable
        String username;

        @Nullable
        String password;

        @Nullable
        String language;

        @Nullable
        Integer maxConnections;

        @Nullable
        Integer connectionTimeout;

        @Nullable
        Boolean validateServer;

        @Nullable
        ProxyConfig proxy;

        Builder(final String apiURL) {
            this.apiURL = Preconditions.checkNotNull(apiURL);
        }

        public Builder credentials(@Nullable final String username,
                @Nullable final String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder language(@Nullable final String language) {
            this.language = language;
            return this;
        }

        public Builder maxConnections(@Nullable final Integer maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder connectionTimeout(@Nullable final Integer connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder validateServer(@Nullable final Boolean validateServer) {
            this.validateServer = validateServer;
            return this;
        }

        public Builder proxy(@Nullable final ProxyConfig proxy) {
            this.proxy = proxy;
            return this;
        }

        public Client build() {
            return new Client(this);
        }

    }

}
