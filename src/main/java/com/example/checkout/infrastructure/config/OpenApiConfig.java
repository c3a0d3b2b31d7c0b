package com.example.checkout.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI checkoutServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Checkout Service API")
                        .description("""
                                電子商務結帳服務 API

                                ## 結帳流程

                                `validate_inventory → create_order → deduct_stock → send_confirmation`

                                - 每個階段皆為冪等，失敗時以指數退避重試（最多 4 次）
                                - 庫存扣減以資料列鎖序列化，不會超賣
                                - 訂單狀態變更透過 WebSocket 即時推送（`/ws/order/{orderId}`、`/ws/user-orders/{userId}`）

                                ## 身分識別

                                由 API Gateway 轉送 `X-User-Id` 標頭
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Checkout Service Team")
                                .email("checkout-service@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
