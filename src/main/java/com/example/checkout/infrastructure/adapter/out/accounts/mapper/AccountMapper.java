package com.example.checkout.infrastructure.adapter.out.accounts.mapper;

import com.example.checkout.application.port.out.UserDirectoryPort.Customer;
import com.example.checkout.infrastructure.adapter.out.accounts.dto.AccountResponse;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Mapper between accounts service DTOs and the customer view used by the pipeline.
 */
@Component
public class AccountMapper {

    public Customer toCustomer(AccountResponse response) {
        return new Customer(
                UUID.fromString(response.id()),
                response.email(),
                response.firstName(),
                response.lastName(),
                response.active()
        );
    }
}
