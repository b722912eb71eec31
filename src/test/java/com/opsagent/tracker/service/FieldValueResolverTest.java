package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsagent.tracker.api.FieldApi;
import com.opsagent.tracker.api.MetadataApi;
import com.opsagent.tracker.api.UserApi;
import com.opsagent.tracker.api.WorkspaceApi;
import com.opsagent.tracker.config.CacheSettings;
import com.opsagent.tracker.model.FieldDefinition;
import com.opsagent.tracker.model.FieldOption;
import com.opsagent.tracker.model.FieldValue;
import com.opsagent.tracker.model.TypeScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class FieldValueResolverTest {

    private static final TypeScope SCOPE = new TypeScope("ws_a", "bug");

    @Mock
    private WorkspaceApi workspaceApi;

    @Mock
    private MetadataApi metadataApi;

    @Mock
    private FieldApi fieldApi;

    @Mock
    private UserApi userApi;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private FieldValueResolver resolver;

    @BeforeEach
    void setUp() {
        List<FieldDefinition> fields = new ArrayList<>(MetadataCacheManagerTest.bugFields());
        fields.add(new FieldDefinition("field_watchers", "关注人", null, "multi_user", null));
        fields.add(new FieldDefinition("field_parent", "父需求", null, "work_item_related_select", null));
        fields.add(new FieldDefinition("field_links", "关联项", null, "work_item_related_multi_select", null));
        fields.add(new FieldDefinition("role_owners", "角色负责人", null, "role_owners", null));
        lenient().when(fieldApi.getAllFields("ws_a", "bug")).thenReturn(fields);

        MetadataCacheManager metadata = new MetadataCacheManager(workspaceApi, metadataApi, fieldApi, userApi,
                new FuzzyOptionMatcher(), new FieldBundleAssembler(new SuffixRoleKeyExtractor()),
                CacheSettings.defaults(), new ManualTicker());
        resolver = new FieldValueResolver(metadata);
    }

    @Test
    void selectValueBecomesLabelAndValue() {
        FieldValue value = resolver.resolveForUpdate(SCOPE, "priority", "优先级", "P1");

        assertThat(value).isEqualTo(new FieldValue.Option("P1", "opt_p1"));
        assertThat(value.toWire(objectMapper).toString()).isEqualTo("{\"label\":\"P1\",\"value\":\"opt_p1\"}");
    }

    @Test
    void unmatchedSelectValueFallsBackToRawText() {
        assertThat(resolver.resolveForUpdate(SCOPE, "priority", "优先级", "P9"))
                .isEqualTo(new FieldValue.Scalar("P9"));
    }

    @Test
    void multiSelectWrapsSingleOptionInAList() {
        FieldValue value = resolver.resolveForUpdate(SCOPE, "field_tags", "标签", "前端");

        assertThat(value).isEqualTo(new FieldValue.MultiOption(List.of(new FieldValue.Option("前端", "tag_fe"))));
        assertThat(value.toWire(objectMapper).isArray()).isTrue();
    }

    @Test
    void multiSelectSplitsDelimitedInputIntoOneFlatList() {
        FieldValue fromText = resolver.resolveForUpdate(SCOPE, "field_tags", "标签", "前端, 后端");
        FieldValue fromList = resolver.resolveForUpdate(SCOPE, "field_tags", "标签", List.of("前端", "后端"));

        FieldValue.MultiOption expected = new FieldValue.MultiOption(List.of(
                new FieldValue.Option("前端", "tag_fe"), new FieldValue.Option("后端", "tag_be")));
        assertThat(fromText).isEqualTo(expected);
        assertThat(fromList).isEqualTo(expected);
        assertThat(fromList.toWire(objectMapper).size()).isEqualTo(2);
    }

    @Test
    void blankMultiSelectClearsTheField() {
        assertThat(resolver.resolveForUpdate(SCOPE, "field_tags", "标签", ""))
                .isEqualTo(new FieldValue.MultiOption(List.of()));
        assertThat(resolver.resolveForUpdate(SCOPE, "field_tags", "标签", null))
                .isEqualTo(new FieldValue.MultiOption(List.of()));
    }

    @Test
    void multiSelectRejectsFreeText() {
        assertThatThrownBy(() -> resolver.resolveForUpdate(SCOPE, "field_tags", "标签", "数据库"))
                .isInstanceOfSatisfying(FieldValidationException.class,
                        e -> assertThat(e.getFieldName()).isEqualTo("标签"));
    }

    @Test
    void freeTextKeepsItsSeparators() {
        assertThat(resolver.resolveForUpdate(SCOPE, "description", "描述", "crash on boot, see log | retry"))
                .isEqualTo(new FieldValue.Scalar("crash on boot, see log | retry"));
    }

    @Test
    void boolAcceptsOnlyItsVocabulary() {
        assertThat(resolver.resolveForUpdate(SCOPE, "field_urgent", "紧急", "Yes")).isEqualTo(new FieldValue.Scalar(true));
        assertThat(resolver.resolveForUpdate(SCOPE, "field_urgent", "紧急", "off")).isEqualTo(new FieldValue.Scalar(false));
        assertThat(resolver.resolveForUpdate(SCOPE, "field_urgent", "紧急", Boolean.TRUE)).isEqualTo(new FieldValue.Scalar(true));
        assertThatThrownBy(() -> resolver.resolveForUpdate(SCOPE, "field_urgent", "紧急", "maybe"))
                .isInstanceOf(FieldValidationException.class)
                .hasMessageContaining("紧急");
    }

    @Test
    void ownerIsResolvedToAUserKey() {
        FieldValue value = resolver.resolveForUpdate(SCOPE, "owner", "assignee", "user_abc123");

        assertThat(value).isEqualTo(new FieldValue.UserRef("user_abc123"));
        assertThat(value.toWire(objectMapper).asText()).isEqualTo("user_abc123");
    }

    @Test
    void multiUserSplitsAndResolvesEachUser() {
        assertThat(resolver.resolveForUpdate(SCOPE, "field_watchers", "关注人", "user_a1; user_b2"))
                .isEqualTo(new FieldValue.MultiUserRef(List.of("user_a1", "user_b2")));
    }

    @Test
    void relatedItemsAreWrittenAsIds() {
        FieldValue single = resolver.resolveForUpdate(SCOPE, "field_parent", "父需求", "6181818812");
        FieldValue multi = resolver.resolveForUpdate(SCOPE, "field_links", "关联项", List.of(11L, "12"));

        assertThat(single.toWire(objectMapper).isNumber()).isTrue();
        assertThat(single.toWire(objectMapper).asLong()).isEqualTo(6181818812L);
        assertThat(multi.toWire(objectMapper).toString()).isEqualTo("[11,12]");
        assertThatThrownBy(() -> resolver.resolveForUpdate(SCOPE, "field_parent", "父需求", "login page"))
                .isInstanceOf(FieldValidationException.class);
    }

    @Test
    void roleOwnersMapRoleNamesToKeys() {
        FieldValue value = resolver.resolveForUpdate(SCOPE, "role_owners", "角色负责人", Map.of("测试", List.of("user_q1")));

        assertThat(value.toWire(objectMapper).toString())
                .isEqualTo("[{\"role\":\"role_qa01\",\"owners\":[\"user_q1\"]}]");
    }

    @Test
    void filterValuesFallBackToTheInput() {
        assertThat(resolver.resolveFilterValue(SCOPE, "priority", "p0")).isEqualTo("opt_p0");
        assertThat(resolver.resolveFilterValue(SCOPE, "priority", "urgent")).isEqualTo("urgent");
    }

    @Test
    void splitsOnSlashBeforeOtherSeparators() {
        assertThat(FieldValueResolver.splitOnFirstSeparator("A / B,C")).containsExactly("A", "B,C");
        assertThat(FieldValueResolver.splitOnFirstSeparator("A;B")).containsExactly("A", "B");
        assertThat(FieldValueResolver.containsSeparator("plain")).isFalse();
    }
}
