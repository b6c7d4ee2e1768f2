package com.livestockmart.marketplace;

import com.livestockmart.marketplace.dto.OrderItemRequest;
import com.livestockmart.marketplace.dto.OrderRequest;
import com.livestockmart.marketplace.model.Address;
import com.livestockmart.marketplace.model.Listing;
import com.livestockmart.marketplace.repository.BasketItemRepository;
import com.livestockmart.marketplace.repository.ListingRepository;
import com.livestockmart.marketplace.repository.NotificationRepository;
import com.livestockmart.marketplace.repository.OrderRepository;
import com.livestockmart.marketplace.repository.OutboxRepository;
import com.livestockmart.marketplace.repository.PaymentProofRepository;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
public abstract class AbstractIntegrationTest {

    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine");

    static final RabbitMQContainer RABBIT = new RabbitMQContainer("rabbitmq:3.11-management-alpine");

    // shared by every integration test class; skipped when the tests are disabled for lack of Docker
    static {
        if (DockerClientFactory.instance().isDockerAvailable()) {
            POSTGRES.start();
            RABBIT.start();
        }
    }

    @DynamicPropertySource
    static void dynamicProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        registry.add("spring.rabbitmq.host", RABBIT::getHost);
        registry.add("spring.rabbitmq.port", RABBIT::getAmqpPort);
        registry.add("spring.rabbitmq.username", RABBIT::getAdminUsername);
        registry.add("spring.rabbitmq.password", RABBIT::getAdminPassword);
    }

    @Autowired
    protected ListingRepository listingRepository;

    @Autowired
    protected OrderRepository orderRepository;

    @Autowired
    protected PaymentProofRepository paymentProofRepository;

    @Autowired
    protected BasketItemRepository basketItemRepository;

    @Autowired
    protected NotificationRepository notificationRepository;

    @Autowired
    protected OutboxRepository outboxRepository;

    @AfterEach
    void cleanDatabase() {
        notificationRepository.deleteAll();
        outboxRepository.deleteAll();
        paymentProofRepository.deleteAll();
        orderRepository.deleteAll();
        basketItemRepository.deleteAll();
        listingRepository.deleteAll();
    }

    protected Listing saveListing(String name, String price) {
        return listingRepository.save(Listing.builder()
                .name(name)
                .category("Goat")
                .breed("Beetal")
                .age("2 years")
                .weight("45kg")
                .price(new BigDecimal(price))
                .build());
    }

    protected static Address address() {
        Address address = new Address();
        address.setName("Ravi Kumar");
        address.setPhone("9876543210");
        address.setLine1("12 Mandi Road");
        address.setCity("Jaipur");
        address.setState("Rajasthan");
        address.setPincode("302001");
        return address;
    }

    protected static OrderRequest orderFor(Listing... listings) {
        List<OrderItemRequest> items = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Listing listing : listings) {
            OrderItemRequest item = new OrderItemRequest();
            item.setListingId(listing.getId());
            item.setPrice(listing.getPrice());
            items.add(item);
            total = total.add(listing.getPrice());
        }
        OrderRequest request = new OrderRequest();
        request.setItems(items);
        request.setTotal(total);
        request.setShippingAddress(address());
        return request;
    }
}
