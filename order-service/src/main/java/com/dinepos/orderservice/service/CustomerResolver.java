package com.dinepos.orderservice.service;

import com.dinepos.orderservice.command.OrderPayload;
import com.dinepos.orderservice.model.Customer;
import com.dinepos.orderservice.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Finds or creates the customer behind a submission, keyed by exact name and
 * normalized contact. Runs before the order header is written.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomerResolver {

    private final CustomerRepository customerRepository;

    /**
     * @return the resolved customer id, or the submitted one when name or contact is missing
     */
    public int resolve(OrderPayload payload) {
        String name = payload.customerName();
        String contact = payload.contact();

        if (name == null || name.isEmpty() || contact == null || contact.isEmpty()) {
            log.debug("Skipping customer resolution, name or contact missing. custId={}", payload.customerId());
            return payload.customerId();
        }

        String normalizedContact = ContactNormalizer.normalize(contact);
        String addressLine = addressLine(payload);

        List<Customer> matches = customerRepository.findActiveByNameAndContact(name, normalizedContact);
        if (!matches.isEmpty()) {
            Customer existing = matches.get(0);
            patchContactDetails(existing, normalizedContact, addressLine);
            log.info("Existing customer matched. custCode={}, contact={}", existing.getCustCode(), normalizedContact);
            return existing.getCustCode();
        }

        return createCustomer(name, normalizedContact, addressLine, payload.flatNo());
    }

    private void patchContactDetails(Customer customer, String normalizedContact, String addressLine) {
        boolean changed = false;

        if (!Objects.equals(customer.getContactNo(), normalizedContact)) {
            customer.setContactNo(normalizedContact);
            changed = true;
        }
        // phone is only backfilled, never overwritten
        if (customer.getPhone() == null || customer.getPhone().isEmpty()) {
            customer.setPhone(normalizedContact);
            changed = true;
        }
        if (!Objects.equals(customer.getAdd1(), addressLine)) {
            customer.setAdd1(addressLine);
            changed = true;
        }

        if (changed) {
            customerRepository.save(customer);
            log.debug("Customer contact details patched. custCode={}", customer.getCustCode());
        }
    }

    private int createCustomer(String name, String normalizedContact, String addressLine, String flatNo) {
        Customer created = customerRepository.save(Customer.builder()
                .custName(name)
                .add1(addressLine)
                .contactNo(normalizedContact)
                .phone(normalizedContact)
                .fax(flatNo == null ? "" : flatNo)
                .active(true)
                .build());

        // newest row wins if two registers created the same customer concurrently
        int custCode = customerRepository
                .findFirstByCustNameAndContactNoAndActiveTrueOrderByCustCodeDesc(name, normalizedContact)
                .map(Customer::getCustCode)
                .orElse(created.getCustCode());

        log.info("New customer created. custCode={}, contact={}", custCode, normalizedContact);
        return custCode;
    }

    private static String addressLine(OrderPayload payload) {
        if (payload.address() != null && !payload.address().isEmpty()) {
            return payload.address();
        }
        return payload.flatNo() == null ? "" : payload.flatNo();
    }
}
