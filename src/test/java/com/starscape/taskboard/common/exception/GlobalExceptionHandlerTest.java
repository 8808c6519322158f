package com.starscape.taskboard.common.exception;

import com.starscape.taskboard.features.deletetask.api.DeleteTaskController;
import com.starscape.taskboard.features.deletetask.app.DeleteTaskHandler;
import com.starscape.taskboard.features.gettask.api.TaskDetailController;
import com.starscape.taskboard.features.gettask.app.GetTaskHandler;
import com.starscape.taskboard.features.listtasks.api.TaskListController;
import com.starscape.taskboard.features.listtasks.app.ListTasksHandler;
import com.starscape.taskboard.features.updatetask.api.UpdateTaskController;
import com.starscape.taskboard.features.updatetask.app.UpdateTaskHandler;
import com.starscape.taskboard.features.updatetask.domain.TaskPatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;


import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {
    TaskDetailController.class,
    TaskListController.class,
    UpdateTaskController.class,
    DeleteTaskController.class
})
class GlobalExceptionHandlerTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private GetTaskHandler getTaskHandler;
    
    @MockBean
    private ListTasksHandler listTasksHandler;
    
    @MockBean
    private UpdateTaskHandler updateTaskHandler;
    
    @MockBean
    private DeleteTaskHandler deleteTaskHandler;
    
    @Test
    @DisplayName("Unknown task returns 404 with the error body")
    void notFoundIsMapped() throws Exception {
        when(getTaskHandler.handle(42L)).thenThrow(new NotFoundException("Task not found: 42"));
        
        mockMvc.perform(get("/tasks/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Task not found: 42"))
                .andExpect(jsonPath("$.timestamp").exists());
    }
    
    @Test
    void nonNumericIdIsValidationError() throws Exception {
        mockMvc.perform(get("/tasks/abc"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.task_id").exists());
    }
    
    @Test
    void outOfRangeQueryParametersAreValidationErrors() throws Exception {
        mockMvc.perform(get("/tasks").param("limit", "0"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.limit").exists());
        mockMvc.perform(get("/tasks").param("priority", "7"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.priority").exists());
        mockMvc.perform(get("/tasks").param("offset", "-1"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(get("/tasks").param("completed", "maybe"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.completed").exists());
        
        verifyNoInteractions(listTasksHandler);
    }
    
    @Test
    void nullForRequiredPatchFieldIsValidationError() throws Exception {
        mockMvc.perform(patch("/tasks/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"due_date\":null}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.due_date").exists());
        
        verifyNoInteractions(updateTaskHandler);
    }
    
    @Test
    void conflictIsMapped() throws Exception {
        when(updateTaskHandler.handle(eq(1L), any(TaskPatch.class)))
                .thenThrow(new ConflictException("Could not resolve tags: [work]"));
        
        mockMvc.perform(patch("/tasks/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tags\":[\"work\"]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));
    }
    
    @Test
    void unsupportedMethodKeepsItsStatus() throws Exception {
        mockMvc.perform(put("/tasks/1"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.code").value("METHOD_NOT_ALLOWED"));
    }
    
    @Test
    void unexpectedExceptionIsInternalServerError() throws Exception {
        when(getTaskHandler.handle(1L)).thenThrow(new IllegalStateException("boom"));
        
        mockMvc.perform(get("/tasks/1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_SERVER_ERROR"))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
