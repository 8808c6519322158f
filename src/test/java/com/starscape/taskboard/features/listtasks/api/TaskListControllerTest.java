package com.starscape.taskboard.features.listtasks.api;

import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;
import com.starscape.taskboard.features.listtasks.api.dto.TaskListResponse;
import com.starscape.taskboard.features.listtasks.app.ListTasksHandler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskListController.class)
class TaskListControllerTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private ListTasksHandler listTasksHandler;
    
    @Test
    void tagFilterIsNormalizedBeforeQuerying() throws Exception {
        mockMvc.perform(get("/tasks").param("tags", " Work ,urgent,work"))
                .andExpect(status().isOk());
        
        verify(listTasksHandler).handle(null, null, List.of("work", "urgent"), null, null);
    }
    
    @Test
    void passesFiltersAndPagination() throws Exception {
        Instant now = Instant.parse("2030-01-01T10:00:00Z");
        TaskResponse task = new TaskResponse(
            7L, "Plan", null, 2, LocalDate.parse("2030-01-02"), true, false, now, now, List.of());
        when(listTasksHandler.handle(true, 2, List.of(), 5, 10L))
                .thenReturn(new TaskListResponse(11, 5, 10, List.of(task)));
        
        mockMvc.perform(get("/tasks")
                        .param("completed", "true")
                        .param("priority", "2")
                        .param("limit", "5")
                        .param("offset", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(11))
                .andExpect(jsonPath("$.limit").value(5))
                .andExpect(jsonPath("$.offset").value(10))
                .andExpect(jsonPath("$.tasks[0].id").value(7))
                .andExpect(jsonPath("$.tasks[0].due_date").value("2030-01-02"))
                .andExpect(jsonPath("$.tasks[0].is_deleted").value(false));
    }
}
