package com.livestockmart.marketplace.mapper;

import com.livestockmart.marketplace.dto.OrderItemResponse;
import com.livestockmart.marketplace.dto.OrderResponse;
import com.livestockmart.marketplace.model.Order;
import com.livestockmart.marketplace.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    @Mapping(target = "paymentProofAttached", expression = "java(order.getProofUploadedAt() != null)")
    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    // No request -> entity mapping: the item snapshot comes from the catalog
    // rows, which only the service layer has at hand
}
