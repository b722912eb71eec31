package com.opsagent.tracker.service;

import com.google.common.base.Ticker;
import com.opsagent.tracker.api.FieldApi;
import com.opsagent.tracker.api.MetadataApi;
import com.opsagent.tracker.api.UserApi;
import com.opsagent.tracker.api.WorkspaceApi;
import com.opsagent.tracker.config.CacheSettings;
import com.opsagent.tracker.dto.ResolvedFieldPath;
import com.opsagent.tracker.model.FieldBundle;
import com.opsagent.tracker.model.ItemType;
import com.opsagent.tracker.model.TrackerUser;
import com.opsagent.tracker.model.TypeScope;
import com.opsagent.tracker.model.UserDirectory;
import com.opsagent.tracker.model.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Name to key resolution for workspaces, item types, fields, options, roles and users.
 *
 * Each category lives in its own {@link LoadingBucket}: one for the workspace list, one per workspace
 * for item types, one per (workspace, type) for the field bundle, and one for the user directory.
 * Buckets are locked independently, so a reload in one workspace never blocks resolution in another.
 */
@Service
public class MetadataCacheManager {

    private static final Logger logger = LoggerFactory.getLogger(MetadataCacheManager.class);
    private static final String FIELD_KEY_PREFIX = "field_";

    private final WorkspaceApi workspaceApi;
    private final MetadataApi metadataApi;
    private final FieldApi fieldApi;
    private final UserApi userApi;
    private final FuzzyOptionMatcher fuzzyOptionMatcher;
    private final FieldBundleAssembler fieldBundleAssembler;
    private final CacheSettings settings;
    private final Ticker ticker;

    private final LoadingBucket<Map<String, String>> workspaceBucket;
    private final ConcurrentMap<String, LoadingBucket<Map<String, String>>> typeBuckets = new ConcurrentHashMap<>();
    private final ConcurrentMap<TypeScope, LoadingBucket<FieldBundle>> fieldBuckets = new ConcurrentHashMap<>();
    private final LoadingBucket<UserDirectory> userBucket;

    public MetadataCacheManager(WorkspaceApi workspaceApi,
                                MetadataApi metadataApi,
                                FieldApi fieldApi,
                                UserApi userApi,
                                FuzzyOptionMatcher fuzzyOptionMatcher,
                                FieldBundleAssembler fieldBundleAssembler,
                                CacheSettings settings,
                                Ticker ticker) {
        this.workspaceApi = workspaceApi;
        this.metadataApi = metadataApi;
        this.fieldApi = fieldApi;
        this.userApi = userApi;
        this.fuzzyOptionMatcher = fuzzyOptionMatcher;
        this.fieldBundleAssembler = fieldBundleAssembler;
        this.settings = settings;
        this.ticker = ticker;
        this.workspaceBucket = new LoadingBucket<>("workspaces", settings.workspaceTtl(), ticker);
        this.userBucket = new LoadingBucket<>("users", settings.userTtl(), ticker);
    }

    // ---- workspaces ----

    /**
     * Workspace key for a workspace name. A known key is returned unchanged.
     */
    public String resolveWorkspaceKey(String name) {
        requireText(name, "workspace name");
        Map<String, String> workspaces = workspaceBucket.getOrReload(
                map -> map.containsKey(name) || map.containsValue(name),
                () -> loadWorkspaces(name));
        String key = workspaces.get(name);
        if (key != null) {
            return key;
        }
        if (workspaces.containsValue(name)) {
            return name;
        }
        throw new MetadataNotFoundException(MetadataNotFoundException.Kind.WORKSPACE, name, new ArrayList<>(workspaces.keySet()));
    }

    /**
     * Name to key for every cached workspace (bounded by the workspace cap).
     */
    public Map<String, String> listWorkspaces() {
        return new LinkedHashMap<>(workspaceBucket.get(() -> loadWorkspaces(null)));
    }

    private Map<String, String> loadWorkspaces(String mustKeep) {
        List<String> keys = workspaceApi.listWorkspaceKeys();
        if (keys.isEmpty()) {
            logger.warn("No workspaces visible to the configured user");
            return Map.of();
        }
        Map<String, String> all = new LinkedHashMap<>();
        for (Workspace workspace : workspaceApi.getWorkspaceDetails(keys)) {
            all.put(workspace.name(), workspace.key());
        }
        logger.info("Loaded {} workspaces", all.size());
        return bounded(all, mustKeep);
    }

    // Keeps the newest entries up to the cap; the name being resolved always survives.
    private Map<String, String> bounded(Map<String, String> all, String mustKeep) {
        int cap = settings.workspaceMaxEntries();
        if (all.size() <= cap) {
            return all;
        }
        String keptName = null;
        if (mustKeep != null) {
            if (all.containsKey(mustKeep)) {
                keptName = mustKeep;
            } else {
                keptName = all.entrySet().stream()
                        .filter(entry -> entry.getValue().equals(mustKeep))
                        .map(Map.Entry::getKey)
                        .findFirst().orElse(null);
            }
        }
        List<Map.Entry<String, String>> others = new ArrayList<>();
        for (Map.Entry<String, String> entry : all.entrySet()) {
            if (!entry.getKey().equals(keptName)) {
                others.add(entry);
            }
        }
        int room = keptName == null ? cap : cap - 1;
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : others.subList(others.size() - room, others.size())) {
            result.put(entry.getKey(), entry.getValue());
        }
        if (keptName != null) {
            result.put(keptName, all.get(keptName));
        }
        logger.debug("Workspace cache limit {} reached, evicted {} oldest entries", cap, all.size() - result.size());
        return result;
    }

    // ---- item types ----

    public String resolveTypeKey(String workspaceKey, String typeName) {
        requireText(typeName, "item type name");
        Map<String, String> types = typeBucket(workspaceKey).getOrReload(
                map -> map.containsKey(typeName) || map.containsValue(typeName),
                () -> loadTypes(workspaceKey));
        String key = types.get(typeName);
        if (key != null) {
            return key;
        }
        if (types.containsValue(typeName)) {
            return typeName;
        }
        throw new MetadataNotFoundException(MetadataNotFoundException.Kind.ITEM_TYPE, typeName, new ArrayList<>(types.keySet()));
    }

    /**
     * Type name to key, in the order the server lists them.
     */
    public Map<String, String> listTypes(String workspaceKey) {
        return new LinkedHashMap<>(typeBucket(workspaceKey).get(() -> loadTypes(workspaceKey)));
    }

    private LoadingBucket<Map<String, String>> typeBucket(String workspaceKey) {
        requireText(workspaceKey, "workspace key");
        return typeBuckets.computeIfAbsent(workspaceKey,
                ws -> new LoadingBucket<>("types:" + ws, settings.typeTtl(), ticker));
    }

    private Map<String, String> loadTypes(String workspaceKey) {
        Map<String, String> types = new LinkedHashMap<>();
        for (ItemType type : metadataApi.getItemTypes(workspaceKey)) {
            types.put(type.name(), type.typeKey());
        }
        logger.info("Loaded {} item types", types.size());
        return types;
    }

    // ---- fields ----

    /**
     * Field key for a field name or alias. Tries exact name/alias, whitespace-insensitive name, the
     * input as a known key, then lets anything shaped like a field key through unchecked.
     */
    public String resolveFieldKey(String workspaceKey, String typeKey, String nameOrAlias) {
        requireText(nameOrAlias, "field name");
        FieldBundle bundle = fieldBundle(workspaceKey, typeKey);
        Map<String, String> names = bundle.nameToKey();

        String key = names.get(nameOrAlias);
        if (key != null) {
            logger.debug("Cache hit: field '{}'", nameOrAlias);
            return key;
        }
        String stripped = nameOrAlias.strip();
        for (Map.Entry<String, String> entry : names.entrySet()) {
            if (entry.getKey().strip().equals(stripped)) {
                logger.info("Field name matched ignoring whitespace: '{}' -> '{}'", nameOrAlias, entry.getKey());
                return entry.getValue();
            }
        }
        if (bundle.isKnownKey(nameOrAlias)) {
            return nameOrAlias;
        }
        if (nameOrAlias.startsWith(FIELD_KEY_PREFIX)) {
            logger.warn("Field '{}' is not in the metadata, using it as a key directly", nameOrAlias);
            return nameOrAlias;
        }
        throw new MetadataNotFoundException(MetadataNotFoundException.Kind.FIELD, nameOrAlias, new ArrayList<>(names.keySet()));
    }

    /**
     * Like {@link #resolveFieldKey} but answers empty instead of raising.
     */
    public Optional<String> findFieldKey(String workspaceKey, String typeKey, String nameOrAlias) {
        try {
            return Optional.of(resolveFieldKey(workspaceKey, typeKey, nameOrAlias));
        } catch (MetadataNotFoundException e) {
            logger.debug("Field '{}' not found: {}", nameOrAlias, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> resolveFieldName(String workspaceKey, String typeKey, String fieldKey) {
        return Optional.ofNullable(fieldBundle(workspaceKey, typeKey).keyToName().get(fieldKey));
    }

    /**
     * Remote field type key (e.g. {@code select}, {@code multi_select}, {@code bool}); empty for unknown fields.
     */
    public Optional<String> resolveFieldType(String workspaceKey, String typeKey, String fieldKey) {
        return Optional.ofNullable(fieldBundle(workspaceKey, typeKey).typeOf(fieldKey));
    }

    public Map<String, String> listFields(String workspaceKey, String typeKey) {
        return new LinkedHashMap<>(fieldBundle(workspaceKey, typeKey).nameToKey());
    }

    FieldBundle fieldBundle(String workspaceKey, String typeKey) {
        requireText(workspaceKey, "workspace key");
        requireText(typeKey, "item type key");
        TypeScope scope = new TypeScope(workspaceKey, typeKey);
        LoadingBucket<FieldBundle> bucket = fieldBuckets.computeIfAbsent(scope,
                s -> new LoadingBucket<>("fields:" + s.typeKey(), settings.fieldTtl(), ticker));
        return bucket.get(() -> {
            FieldBundle bundle = fieldBundleAssembler.assemble(fieldApi.getAllFields(workspaceKey, typeKey));
            logger.info("Loaded {} fields for item type {}", bundle.keyToName().size(), typeKey);
            return bundle;
        });
    }

    // ---- options ----

    /**
     * Exact label, then the input as an option value, then the fuzzy strategies. Never raises.
     */
    public OptionMatch matchOption(String workspaceKey, String typeKey, String fieldKey, String label) {
        if (label == null) {
            return OptionMatch.none();
        }
        Map<String, String> options = fieldBundle(workspaceKey, typeKey).options(fieldKey);
        String value = options.get(label);
        if (value != null) {
            logger.debug("Cache hit: option '{}'", label);
            return OptionMatch.of(label, value);
        }
        if (options.containsValue(label)) {
            return OptionMatch.of(label, label);
        }
        return fuzzyOptionMatcher.match(label, options);
    }

    public String resolveOptionValue(String workspaceKey, String typeKey, String fieldKey, String label) {
        OptionMatch match = matchOption(workspaceKey, typeKey, fieldKey, label);
        if (match.matched()) {
            return match.value();
        }
        if (match.isAmbiguous()) {
            throw MetadataNotFoundException.ambiguous(MetadataNotFoundException.Kind.OPTION, label, match.candidates());
        }
        List<String> available = new ArrayList<>(listOptions(workspaceKey, typeKey, fieldKey).keySet());
        logger.error("Option '{}' not found for field {}. Available options: {}", label, fieldKey, available);
        throw new MetadataNotFoundException(MetadataNotFoundException.Kind.OPTION, label, available);
    }

    public Map<String, String> listOptions(String workspaceKey, String typeKey, String fieldKey) {
        return new LinkedHashMap<>(fieldBundle(workspaceKey, typeKey).options(fieldKey));
    }

    // ---- roles ----

    public String resolveRoleKey(String workspaceKey, String typeKey, String roleName) {
        requireText(roleName, "role name");
        Map<String, String> roles = fieldBundle(workspaceKey, typeKey).roles();
        String key = roles.get(roleName);
        if (key != null) {
            return key;
        }
        if (roles.containsValue(roleName)) {
            return roleName;
        }
        String normalized = roleName.strip().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : roles.entrySet()) {
            if (entry.getKey().strip().toLowerCase(Locale.ROOT).equals(normalized)) {
                logger.info("Role matched ignoring case: '{}' -> '{}'", roleName, entry.getKey());
                return entry.getValue();
            }
        }
        throw new MetadataNotFoundException(MetadataNotFoundException.Kind.ROLE, roleName, new ArrayList<>(roles.keySet()));
    }

    /**
     * Role name for a role key; full role option values containing the short key also match.
     */
    public Optional<String> resolveRoleName(String workspaceKey, String typeKey, String roleKey) {
        if (!StringUtils.hasText(roleKey)) {
            return Optional.empty();
        }
        Map<String, String> roles = fieldBundle(workspaceKey, typeKey).roles();
        for (Map.Entry<String, String> entry : roles.entrySet()) {
            if (entry.getValue().equals(roleKey)) {
                return Optional.of(entry.getKey());
            }
        }
        for (Map.Entry<String, String> entry : roles.entrySet()) {
            if (roleKey.contains(entry.getValue())) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    // ---- users ----

    public String resolveUserKey(String identifier) {
        return resolveUserKey(identifier, null);
    }

    /**
     * User key for a name, email or key. Identifiers shaped like a key are used without a search;
     * otherwise the directory is searched and every returned user is cached. If the identifier is not
     * among the results verbatim, the first result wins.
     */
    public String resolveUserKey(String identifier, String workspaceKey) {
        requireText(identifier, "user identifier");
        UserDirectory directory = userBucket.merge(
                dir -> dir.contains(identifier),
                dir -> searchUser(dir, identifier, workspaceKey),
                UserDirectory.empty());
        return directory.keyFor(identifier)
                .orElseThrow(() -> new MetadataNotFoundException(MetadataNotFoundException.Kind.USER, identifier, List.of()));
    }

    private UserDirectory searchUser(UserDirectory base, String identifier, String workspaceKey) {
        if (UserIdentifiers.looksLikeUserKey(identifier)) {
            logger.debug("Identifier '{}' looks like a user key, using it directly", identifier);
            return base.withIdentifier(identifier, identifier);
        }
        List<TrackerUser> users = userApi.searchUsers(identifier, workspaceKey);
        if (users.isEmpty()) {
            throw new MetadataNotFoundException(MetadataNotFoundException.Kind.USER, identifier, List.of());
        }
        UserDirectory next = base;
        List<String> names = new ArrayList<>();
        for (TrackerUser user : users) {
            next = next.withUser(user);
            if (user.displayName() != null) {
                names.add(user.displayName());
            }
        }
        if (next.contains(identifier)) {
            return next;
        }
        for (TrackerUser user : users) {
            if (StringUtils.hasText(user.userKey())) {
                logger.info("User '{}' not matched verbatim, using first search result", identifier);
                return next.withIdentifier(identifier, user.userKey());
            }
        }
        throw new MetadataNotFoundException(MetadataNotFoundException.Kind.USER, identifier, names);
    }

    public Optional<String> resolveUserName(String userKey) {
        if (!StringUtils.hasText(userKey)) {
            return Optional.empty();
        }
        return Optional.ofNullable(batchResolveUserNames(List.of(userKey)).get(userKey));
    }

    /**
     * Display names for the given keys. Cached names are used first; the rest are fetched with one
     * query. Keys that stay unknown are left out. Lookup failures are logged, never raised.
     */
    public Map<String, String> batchResolveUserNames(Collection<String> userKeys) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String key : userKeys) {
            if (StringUtils.hasText(key)) {
                wanted.add(key);
            }
        }
        if (wanted.isEmpty()) {
            return Map.of();
        }
        UserDirectory directory;
        try {
            directory = userBucket.merge(
                    dir -> wanted.stream().allMatch(key -> dir.nameFor(key).isPresent()),
                    dir -> {
                        List<String> missing = new ArrayList<>();
                        for (String key : wanted) {
                            if (dir.nameFor(key).isEmpty()) {
                                missing.add(key);
                            }
                        }
                        UserDirectory next = dir;
                        for (TrackerUser user : userApi.queryUsers(missing)) {
                            next = next.withUser(user);
                        }
                        return next;
                    },
                    UserDirectory.empty());
        } catch (RuntimeException e) {
            logger.warn("Failed to look up user names: {}", e.getMessage());
            directory = userBucket.peek().orElse(UserDirectory.empty());
        }

        Map<String, String> names = new LinkedHashMap<>();
        for (String key : wanted) {
            directory.nameFor(key).ifPresent(name -> names.put(key, name));
        }
        return names;
    }

    // ---- composite ----

    /**
     * Resolves workspace name, type name, field name and (optionally) an option label in one call.
     */
    public ResolvedFieldPath resolveFieldPath(String workspaceName, String typeName, String fieldName, String optionLabel) {
        String workspaceKey = resolveWorkspaceKey(workspaceName);
        String typeKey = resolveTypeKey(workspaceKey, typeName);
        String fieldKey = resolveFieldKey(workspaceKey, typeKey, fieldName);
        String optionValue = StringUtils.hasText(optionLabel)
                ? resolveOptionValue(workspaceKey, typeKey, fieldKey, optionLabel)
                : null;
        return new ResolvedFieldPath(workspaceKey, typeKey, fieldKey, optionValue);
    }

    // ---- invalidation ----

    public void clearAll() {
        workspaceBucket.invalidate();
        typeBuckets.clear();
        fieldBuckets.clear();
        userBucket.invalidate();
        logger.info("Metadata cache cleared");
    }

    /**
     * Drops the item type and field buckets of one workspace; other workspaces are untouched.
     */
    public void invalidateWorkspace(String workspaceKey) {
        typeBuckets.remove(workspaceKey);
        fieldBuckets.keySet().removeIf(scope -> scope.workspaceKey().equals(workspaceKey));
        logger.info("Metadata cache cleared for one workspace");
    }

    public void invalidateFields(String workspaceKey, String typeKey) {
        LoadingBucket<FieldBundle> bucket = fieldBuckets.get(new TypeScope(workspaceKey, typeKey));
        if (bucket != null) {
            bucket.invalidate();
        }
    }

    public void invalidateUsers() {
        userBucket.invalidate();
    }

    private static void requireText(String value, String what) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
    }
}
