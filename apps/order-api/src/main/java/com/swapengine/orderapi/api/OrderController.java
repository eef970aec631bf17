package com.swapengine.orderapi.api;

import com.swapengine.orderapi.orders.OrderSubmissionService;
import com.swapengine.orderapi.orders.SubmitOrderCommand;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OrderController {
  private static final String RUNNING_STATUS = "Order Execution Engine Running";

  private final OrderSubmissionService orderSubmissionService;

  public OrderController(OrderSubmissionService orderSubmissionService) {
    this.orderSubmissionService = orderSubmissionService;
  }

  @GetMapping("/")
  public ServiceStatusResponse status() {
    return new ServiceStatusResponse(RUNNING_STATUS);
  }

  @PostMapping("/api/orders/execute")
  public ResponseEntity<ExecuteOrderResponse> executeOrder(
      @Valid @RequestBody ExecuteOrderRequest request) {
    String orderId =
        orderSubmissionService.submit(
            new SubmitOrderCommand(request.tokenIn(), request.tokenOut(), request.amount()));
    return ResponseEntity.accepted().body(ExecuteOrderResponse.submitted(orderId));
  }
}
