package com.starscape.taskboard.features.updatetask.app;

import com.starscape.taskboard.common.exception.InvalidRequestException;
import com.starscape.taskboard.common.exception.NotFoundException;
import com.starscape.taskboard.features.createtask.api.dto.TagResponse;
import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;
import com.starscape.taskboard.features.createtask.app.TaskResponseAssembler;
import com.starscape.taskboard.features.createtask.domain.Task;
import com.starscape.taskboard.features.createtask.domain.TaskRepository;
import com.starscape.taskboard.features.tags.app.TagResolver;
import com.starscape.taskboard.features.tags.app.TaskTagAssigner;
import com.starscape.taskboard.features.tags.app.TaskTagLoader;
import com.starscape.taskboard.features.tags.domain.Tag;
import com.starscape.taskboard.features.updatetask.domain.FieldUpdate;
import com.starscape.taskboard.features.updatetask.domain.TaskPatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpdateTaskHandlerTest {
    
    private static final LocalDate DUE = LocalDate.now().plusDays(2);
    
    @Mock
    private TaskRepository taskRepository;
    
    @Mock
    private TagResolver tagResolver;
    
    @Mock
    private TaskTagAssigner taskTagAssigner;
    
    @Mock
    private TaskTagLoader taskTagLoader;
    
    private UpdateTaskHandler handler;
    private Task task;
    
    @BeforeEach
    void setUp() {
        handler = new UpdateTaskHandler(
            taskRepository, tagResolver, taskTagAssigner, taskTagLoader, new TaskResponseAssembler());
        task = new Task("Original", "Details", 4, DUE);
        ReflectionTestUtils.setField(task, "id", 1L);
    }
    
    @Test
    void updatingTitleLeavesOtherFieldsAndTags() {
        Instant updatedBefore = task.getUpdatedAt();
        when(taskRepository.findByIdAndDeletedFalse(1L)).thenReturn(Optional.of(task));
        when(taskTagLoader.loadTagsForTask(1L)).thenReturn(List.of(tag(3L, "work")));
        
        TaskResponse response = handler.handle(1L, TaskPatch.empty().withTitle(FieldUpdate.set("X")));
        
        assertThat(response.title()).isEqualTo("X");
        assertThat(response.description()).isEqualTo("Details");
        assertThat(response.priority()).isEqualTo(4);
        assertThat(response.dueDate()).isEqualTo(DUE);
        assertThat(response.tags()).extracting(TagResponse::name).containsExactly("work");
        assertThat(response.updatedAt()).isAfterOrEqualTo(updatedBefore);
        verify(taskRepository).save(task);
        verifyNoInteractions(tagResolver, taskTagAssigner);
    }
    
    @Test
    void clearingTagsRemovesAllAssociations() {
        when(taskRepository.findByIdAndDeletedFalse(1L)).thenReturn(Optional.of(task));
        
        TaskResponse response = handler.handle(1L, TaskPatch.empty().withTags(FieldUpdate.clear()));
        
        assertThat(response.tags()).isEmpty();
        verify(taskTagAssigner).replaceTags(1L, List.of());
        verifyNoInteractions(tagResolver, taskTagLoader);
    }
    
    @Test
    void settingTagsReplacesTheSet() {
        Tag home = tag(5L, "home");
        Tag errands = tag(6L, "errands");
        when(taskRepository.findByIdAndDeletedFalse(1L)).thenReturn(Optional.of(task));
        when(tagResolver.resolve(List.of("home", "errands"))).thenReturn(List.of(home, errands));
        
        TaskResponse response = handler.handle(1L,
            TaskPatch.empty().withTags(FieldUpdate.set(List.of("home", "errands"))));
        
        assertThat(response.tags()).extracting(TagResponse::name).containsExactly("errands", "home");
        verify(taskTagAssigner).replaceTags(1L, List.of(errands, home));
    }
    
    @Test
    void clearingDescriptionSetsItToNull() {
        when(taskRepository.findByIdAndDeletedFalse(1L)).thenReturn(Optional.of(task));
        when(taskTagLoader.loadTagsForTask(1L)).thenReturn(List.of());
        
        TaskResponse response = handler.handle(1L, TaskPatch.empty()
                .withDescription(FieldUpdate.clear())
                .withCompleted(FieldUpdate.set(true))
                .withPriority(FieldUpdate.set(1)));
        
        assertThat(response.description()).isNull();
        assertThat(response.completed()).isTrue();
        assertThat(response.priority()).isEqualTo(1);
        assertThat(response.title()).isEqualTo("Original");
    }
    
    @Test
    void clearingRequiredFieldIsRejected() {
        when(taskRepository.findByIdAndDeletedFalse(1L)).thenReturn(Optional.of(task));
        
        assertThatThrownBy(() -> handler.handle(1L, TaskPatch.empty().withDueDate(FieldUpdate.clear())))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("field")
                .isEqualTo("dueDate");
        verify(taskRepository, never()).save(any());
    }
    
    @Test
    void unknownOrDeletedTaskIsNotFound() {
        when(taskRepository.findByIdAndDeletedFalse(99L)).thenReturn(Optional.empty());
        
        assertThatThrownBy(() -> handler.handle(99L, TaskPatch.empty().withTitle(FieldUpdate.set("X"))))
                .isInstanceOf(NotFoundException.class);
        verify(taskRepository, never()).save(any());
        verify(taskTagAssigner, never()).replaceTags(anyLong(), anyCollection());
    }
    
    private static Tag tag(Long id, String name) {
        Tag tag = new Tag(name);
        ReflectionTestUtils.setField(tag, "id", id);
        return tag;
    }
}
