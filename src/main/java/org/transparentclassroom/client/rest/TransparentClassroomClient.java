package org.transparentclassroom.client.rest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transparentclassroom.client.model.Activity;
import org.transparentclassroom.client.model.AuthResult;
import org.transparentclassroom.client.model.CallShape;
import org.transparentclassroom.client.model.Child;
import org.transparentclassroom.client.model.Classroom;
import org.transparentclassroom.client.model.ConferenceReport;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.Event;
import org.transparentclassroom.client.model.Form;
import org.transparentclassroom.client.model.FormTemplate;
import org.transparentclassroom.client.model.LessonSet;
import org.transparentclassroom.client.model.Level;
import org.transparentclassroom.client.model.MappedRecord;
import org.transparentclassroom.client.model.OnlineApplication;
import org.transparentclassroom.client.model.School;
import org.transparentclassroom.client.model.Session;
import org.transparentclassroom.client.model.User;
import org.transparentclassroom.client.rest.config.ClientConfiguration;
import org.transparentclassroom.client.rest.config.ClientSettings;
import org.transparentclassroom.client.rest.parser.JsonResponseParser;
import org.transparentclassroom.client.rest.parser.ResponseParser;
import org.transparentclassroom.client.rest.service.HttpRequestBuilder;
import org.transparentclassroom.client.rest.service.HttpRequestExecutor;
import org.transparentclassroom.client.rest.service.Route;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.transparentclassroom.client.rest.exception.MalformedFieldException.buildMalformedFieldException;
import static org.transparentclassroom.client.rest.exception.MissingRequiredFieldException.buildMissingRequiredFieldException;

/**
 * Read-only client of the Transparent Classroom API.
 *
 * <p>Authenticates lazily on first use. Detail accessors return the typed record; list
 * accessors return a {@link MappingBatch} whose failures follow the configured
 * {@link MappingPolicy}.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * TransparentClassroomClient client = new TransparentClassroomClient(settings);
 * MappingBatch<Child> children = client.getChildren(classroomId, null, true, 1, 50);
 * for (Child child : children.getRecords()) {
 *     ...
 * }
 * }</pre>
 */
public class TransparentClassroomClient {

    private static final Logger logger = LoggerFactory.getLogger(TransparentClassroomClient.class);

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PER_PAGE = 50;

    private final ClientSettings settings;
    private final HttpRequestBuilder requestBuilder;
    private final HttpRequestExecutor executor;
    private final ResponseParser parser = new JsonResponseParser();
    private final EntityMapper entityMapper;
    private final CollectionMapper collectionMapper;

    private volatile String apiToken;

    public TransparentClassroomClient(ClientSettings settings) {
        this(settings, new HttpRequestExecutor());
    }

    public TransparentClassroomClient(ClientSettings settings, HttpRequestExecutor executor) {
        this.settings = settings;
        this.requestBuilder = new HttpRequestBuilder(settings);
        this.executor = executor;
        this.entityMapper = new EntityMapper(MappingContext.builder()
                .zone(SchoolTimeZones.resolve(settings.getTimeZone()))
                .policy(settings.getMappingPolicy())
                .build());
        this.collectionMapper = new CollectionMapper(entityMapper);
    }

    public static TransparentClassroomClient fromConfiguration(ClientConfiguration config) {
        return new TransparentClassroomClient(ClientSettings.from(config));
    }

    public ClientSettings getSettings() {
        return settings;
    }

    public MappingContext getMappingContext() {
        return entityMapper.getContext();
    }

    public boolean isAuthenticated() {
        return apiToken != null;
    }

    /**
     * Exchanges the configured email and password for an API token.
     *
     * @return token, school and the authenticated user
     * @throws IOException if the request fails or the response cannot be parsed
     */
    public AuthResult authenticate() throws IOException {
        String route = Route.AUTHENTICATE.render(null);
        String body = executor.executeRequest(requestBuilder.buildAuthenticateRequest(route));
        Object raw = parse(route, body);
        if (!(raw instanceof Map)) {
            throw buildMalformedFieldException(EntityKind.USER, null, raw, "expected a JSON object");
        }

        Map<?, ?> response = (Map<?, ?>) raw;
        Object token = response.get("api_token");
        if (token == null) {
            throw buildMissingRequiredFieldException(EntityKind.USER, "api_token");
        }
        if (!(token instanceof String)) {
            throw buildMalformedFieldException(EntityKind.USER, "api_token", token, "expected a string");
        }
        Integer schoolId = (Integer) ValueConverter.convert(response.get("school_id"), FieldType.INTEGER,
                EntityKind.USER, "school_id", entityMapper.getContext());
        User user = entityMapper.map(EntitySchemas.USER, response, CallShape.DETAIL,
                Arrays.asList("api_token", "school_id"));

        apiToken = (String) token;
        logger.info("Authenticated as user {} (school {})", user.getId(), schoolId);
        return new AuthResult(apiToken, schoolId, user);
    }

    /**
     * Observations, presentations and photos of a child or classroom.
     *
     * @throws IllegalArgumentException if neither a child nor a classroom is given
     */
    public MappingBatch<Activity> getActivities(Integer childId, Integer classroomId, boolean onlyPhotos,
                                                boolean onlyPortfolio, LocalDate dateStart, LocalDate dateEnd,
                                                int page, int perPage) throws IOException {
        if (childId == null && classroomId == null) {
            throw new IllegalArgumentException("Either a childId or a classroomId needs to be provided");
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("child_id", childId);
        parameters.put("classroom_id", classroomId);
        parameters.put("only_photos", onlyPhotos);
        parameters.put("only_portfolio", onlyPortfolio);
        parameters.put("date_start", dateStart);
        parameters.put("date_end", dateEnd);
        return list(EntitySchemas.ACTIVITY, paging(parameters, page, perPage));
    }

    /**
     * @param asOf shows the child's fields as of this date, or today when null
     */
    public Child getChild(int childId, LocalDate asOf) throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("as_of", asOf);
        return show(EntitySchemas.CHILD, childId, parameters);
    }

    public MappingBatch<Child> getChildren(Integer classroomId, Integer sessionId, boolean onlyCurrent,
                                           int page, int perPage) throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("classroom_id", classroomId);
        parameters.put("session_id", sessionId);
        parameters.put("only_current", onlyCurrent);
        return list(EntitySchemas.CHILD, paging(parameters, page, perPage));
    }

    public MappingBatch<Classroom> getClassrooms(boolean showInactive, int page, int perPage) throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("show_inactive", showInactive);
        return list(EntitySchemas.CLASSROOM, paging(parameters, page, perPage));
    }

    public MappingBatch<ConferenceReport> getConferenceReports(Integer childId, LocalDate createdAfter,
                                                               LocalDate createdBefore, int page, int perPage)
            throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("child_id", childId);
        parameters.put("created_after", createdAfter);
        parameters.put("created_before", createdBefore);
        return list(EntitySchemas.CONFERENCE_REPORT, paging(parameters, page, perPage));
    }

    public MappingBatch<Event> getEvents(Integer childId, Integer classroomId, LocalDate dateStart,
                                         LocalDate dateEnd, int page, int perPage) throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("child_id", childId);
        parameters.put("classroom_id", classroomId);
        parameters.put("date_start", dateStart);
        parameters.put("date_end", dateEnd);
        return list(EntitySchemas.EVENT, paging(parameters, page, perPage));
    }

    public Form getForm(int formId) throws IOException {
        return show(EntitySchemas.FORM, formId, null);
    }

    public MappingBatch<Form> getForms(Integer formTemplateId, Integer childId, LocalDate createdAfter,
                                       LocalDate createdBefore, int page, int perPage) throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("form_template_id", formTemplateId);
        parameters.put("child_id", childId);
        parameters.put("created_after", createdAfter);
        parameters.put("created_before", createdBefore);
        return list(EntitySchemas.FORM, paging(parameters, page, perPage));
    }

    public MappingBatch<FormTemplate> getFormTemplates(int page, int perPage) throws IOException {
        return list(EntitySchemas.FORM_TEMPLATE, paging(new LinkedHashMap<>(), page, perPage));
    }

    /**
     * @param format {@code short} (default) or {@code long}, which adds photos and descriptions
     */
    public LessonSet getLessonSet(int lessonSetId, String format) throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("format", format);
        return show(EntitySchemas.LESSON_SET, lessonSetId, parameters);
    }

    public MappingBatch<Level> getLevels(Integer childId, int page, int perPage) throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("child_id", childId);
        return list(EntitySchemas.LEVEL, paging(parameters, page, perPage));
    }

    /**
     * Levels of every child of a classroom recorded on one date.
     */
    public MappingBatch<Level> getLevelsByDate(Integer classroomId, LocalDate date) throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("classroom_id", classroomId);
        parameters.put("date", date);
        return list(EntitySchemas.LEVEL, Route.LEVELS_BY_DATE, parameters);
    }

    public OnlineApplication getOnlineApplication(int onlineApplicationId) throws IOException {
        return show(EntitySchemas.ONLINE_APPLICATION, onlineApplicationId, null);
    }

    /**
     * @param createdAt only applications completed on or after this instant, or all when null
     */
    public MappingBatch<OnlineApplication> getOnlineApplications(ZonedDateTime createdAt, int page, int perPage)
            throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("created_at", createdAt);
        return list(EntitySchemas.ONLINE_APPLICATION, paging(parameters, page, perPage));
    }

    public MappingBatch<School> getSchools(int page, int perPage) throws IOException {
        return list(EntitySchemas.SCHOOL, paging(new LinkedHashMap<>(), page, perPage));
    }

    public MappingBatch<Session> getSessions(int page, int perPage) throws IOException {
        return list(EntitySchemas.SESSION, paging(new LinkedHashMap<>(), page, perPage));
    }

    public User getUser(int userId) throws IOException {
        return show(EntitySchemas.USER, userId, null);
    }

    /**
     * @param roles any of teacher, parent, admin, billing_manager, family_member; all when null
     */
    public MappingBatch<User> getUsers(Integer classroomId, List<String> roles, int page, int perPage)
            throws IOException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("classroom_id", classroomId);
        parameters.put("roles", roles);
        return list(EntitySchemas.USER, paging(parameters, page, perPage));
    }

    private <R extends MappedRecord> MappingBatch<R> list(EntitySchema<R> schema, Map<String, Object> parameters)
            throws IOException {
        return list(schema, Route.LIST, parameters);
    }

    private <R extends MappedRecord> MappingBatch<R> list(EntitySchema<R> schema, Route route,
                                                          Map<String, Object> parameters) throws IOException {
        Object raw = fetch(route.render(schema.getKind()), parameters);
        return collectionMapper.mapMany(schema, raw, CallShape.LIST, settings.getMappingPolicy());
    }

    private <R extends MappedRecord> R show(EntitySchema<R> schema, int id, Map<String, Object> parameters)
            throws IOException {
        Object raw = fetch(Route.SHOW.render(schema.getKind(), id), parameters);
        return entityMapper.map(schema, raw, CallShape.DETAIL);
    }

    private Object fetch(String route, Map<String, Object> parameters) throws IOException {
        if (apiToken == null) {
            authenticate();
        }
        String body = executor.executeRequest(requestBuilder.buildRequest(route, parameters, apiToken));
        return parse(route, body);
    }

    private Object parse(String route, String body) throws IOException {
        try {
            return parser.parse(body);
        } catch (ResponseParser.ParseException e) {
            throw new IOException("Could not parse response of " + route, e);
        }
    }

    private static Map<String, Object> paging(Map<String, Object> parameters, int page, int perPage) {
        parameters.put("page", page);
        parameters.put("per_page", perPage);
        return parameters;
    }
}
