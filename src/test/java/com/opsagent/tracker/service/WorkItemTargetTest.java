package com.opsagent.tracker.service;

import com.opsagent.tracker.config.WorkspaceDefaults;
import com.opsagent.tracker.model.TypeScope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkItemTargetTest {

    @Mock
    private MetadataCacheManager metadata;

    @Test
    void configuredKeyIsUsedAndTheScopeIsReused() {
        WorkItemTarget target = new WorkItemTarget(metadata, new WorkspaceDefaults("ws_a", null, "缺陷"));
        when(metadata.resolveTypeKey("ws_a", "缺陷")).thenReturn("bug");

        assertThat(target.scope()).isEqualTo(new TypeScope("ws_a", "bug"));
        assertThat(target.scope()).isEqualTo(new TypeScope("ws_a", "bug"));

        verify(metadata, times(1)).resolveTypeKey("ws_a", "缺陷");
        verify(metadata, never()).resolveWorkspaceKey(anyString());
    }

    @Test
    void workspaceNameIsResolved() {
        WorkItemTarget target = new WorkItemTarget(metadata, new WorkspaceDefaults(null, "Platform", "缺陷"));
        when(metadata.resolveWorkspaceKey("Platform")).thenReturn("ws_p");
        when(metadata.resolveTypeKey("ws_p", "缺陷")).thenReturn("bug");

        assertThat(target.scope().workspaceKey()).isEqualTo("ws_p");
    }

    @Test
    void missingWorkspaceIsAConfigurationError() {
        WorkItemTarget target = new WorkItemTarget(metadata, new WorkspaceDefaults(" ", null, null));

        assertThatThrownBy(target::scope).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void builtInTypeFallsBackToTheFirstType() {
        WorkItemTarget target = new WorkItemTarget(metadata, new WorkspaceDefaults("ws_a", null, null));
        when(metadata.resolveTypeKey("ws_a", WorkspaceDefaults.FALLBACK_TYPE_NAME))
                .thenThrow(new MetadataNotFoundException(MetadataNotFoundException.Kind.ITEM_TYPE,
                        WorkspaceDefaults.FALLBACK_TYPE_NAME, List.of("需求", "缺陷")));
        Map<String, String> types = new LinkedHashMap<>();
        types.put("需求", "story");
        types.put("缺陷", "bug");
        when(metadata.listTypes("ws_a")).thenReturn(types);

        assertThat(target.scope().typeKey()).isEqualTo("story");
    }

    @Test
    void configuredTypeMustExist() {
        WorkItemTarget target = new WorkItemTarget(metadata, new WorkspaceDefaults("ws_a", null, "任务"));
        when(metadata.resolveTypeKey("ws_a", "任务"))
                .thenThrow(new MetadataNotFoundException(MetadataNotFoundException.Kind.ITEM_TYPE, "任务", List.of("缺陷")));

        assertThatThrownBy(target::scope).isInstanceOf(MetadataNotFoundException.class);
        verify(metadata, never()).listTypes(anyString());
    }

    @Test
    void resetResolvesAgain() {
        WorkItemTarget target = new WorkItemTarget(metadata, new WorkspaceDefaults("ws_a", null, "缺陷"));
        when(metadata.resolveTypeKey("ws_a", "缺陷")).thenReturn("bug");

        target.scope();
        target.reset();
        target.scope();

        verify(metadata, times(2)).resolveTypeKey("ws_a", "缺陷");
    }
}
