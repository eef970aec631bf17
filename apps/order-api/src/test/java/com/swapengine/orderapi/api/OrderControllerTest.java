package com.swapengine.orderapi.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.swapengine.infra.kafka.producer.EnqueueFailedException;
import com.swapengine.orderapi.orders.OrderSubmissionService;
import com.swapengine.orderapi.orders.SubmitOrderCommand;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(OrderController.class)
class OrderControllerTest {
  @Autowired private MockMvc mockMvc;
  @MockBean private OrderSubmissionService orderSubmissionService;

  @Test
  void rootShouldReportRunning() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("Order Execution Engine Running"));
  }

  @Test
  void executeShouldAcceptValidOrder() throws Exception {
    when(orderSubmissionService.submit(any())).thenReturn("ord-42");

    mockMvc
        .perform(
            post("/api/orders/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tokenIn\":\"USDC\",\"tokenOut\":\"SOL\",\"amount\":100}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.orderId").value("ord-42"))
        .andExpect(jsonPath("$.message").value("Order submitted successfully"));

    ArgumentCaptor<SubmitOrderCommand> captor = ArgumentCaptor.forClass(SubmitOrderCommand.class);
    verify(orderSubmissionService).submit(captor.capture());
    assertEquals("USDC", captor.getValue().tokenIn());
    assertEquals("SOL", captor.getValue().tokenOut());
    assertEquals(
        0, new BigDecimal("100").compareTo(captor.getValue().amount()));
  }

  @Test
  void executeShouldRejectMissingTokenOut() throws Exception {
    mockMvc
        .perform(
            post("/api/orders/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tokenIn\":\"USDC\",\"amount\":100}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Missing required fields"));

    verify(orderSubmissionService, never()).submit(any());
  }

  @Test
  void executeShouldRejectNonPositiveAmount() throws Exception {
    mockMvc
        .perform(
            post("/api/orders/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tokenIn\":\"USDC\",\"tokenOut\":\"SOL\",\"amount\":0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Missing required fields"));

    verify(orderSubmissionService, never()).submit(any());
  }

  @Test
  void executeShouldRejectMalformedBody() throws Exception {
    mockMvc
        .perform(
            post("/api/orders/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tokenIn\":\"USDC\",\"tokenOut\":\"SOL\",\"amount\":\"lots\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Missing required fields"));

    verify(orderSubmissionService, never()).submit(any());
  }

  @Test
  void executeShouldReturnServiceUnavailableWhenQueueIsDown() throws Exception {
    when(orderSubmissionService.submit(any()))
        .thenThrow(
            new EnqueueFailedException(
                "orders.submitted.v1", "ord-1", "broker down", new IllegalStateException()));

    mockMvc
        .perform(
            post("/api/orders/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tokenIn\":\"USDC\",\"tokenOut\":\"SOL\",\"amount\":1.5}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.title").value("Service Unavailable"));
  }
}
