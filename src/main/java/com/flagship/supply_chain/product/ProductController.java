package com.flagship.supply_chain.product;

import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.events.LoggedEvent;
import com.flagship.supply_chain.product.dto.CreateProductRequest;
import com.flagship.supply_chain.product.dto.ProductResponse;
import com.flagship.supply_chain.product.dto.ShipProductRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for product lifecycle transitions.
 *
 * The authenticated principal arrives in the X-Principal header; every transition
 * endpoint requires it. Reads are open.
 */
@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private static final String PRINCIPAL_HEADER = "X-Principal";

    private final ProductLifecycleService lifecycleService;

    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(
            @Valid @RequestBody CreateProductRequest request,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        Product product = lifecycleService.createProduct(Principal.of(caller),
            request.getName(), request.getOrigin(), request.getPrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.from(product));
    }

    @GetMapping
    public ResponseEntity<List<ProductResponse>> listProducts() {
        return ResponseEntity.ok(lifecycleService.listProducts().stream()
            .map(ProductResponse::from)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("id") long id) {
        return ResponseEntity.ok(ProductResponse.from(lifecycleService.getProduct(id)));
    }

    @GetMapping("/{id}/events")
    public ResponseEntity<List<LoggedEvent>> getProductEvents(@PathVariable("id") long id) {
        return ResponseEntity.ok(lifecycleService.eventsFor(id));
    }

    @PostMapping("/{id}/payment")
    public ResponseEntity<ProductResponse> payForProduct(
            @PathVariable("id") long id,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        return ResponseEntity.ok(ProductResponse.from(
            lifecycleService.payForProduct(Principal.of(caller), id)));
    }

    @PostMapping("/{id}/shipment")
    public ResponseEntity<ProductResponse> shipProduct(
            @PathVariable("id") long id,
            @Valid @RequestBody ShipProductRequest request,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        return ResponseEntity.ok(ProductResponse.from(
            lifecycleService.shipProduct(Principal.of(caller), id, request.getLocation())));
    }

    @PostMapping("/{id}/receipt")
    public ResponseEntity<ProductResponse> receiveProduct(
            @PathVariable("id") long id,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        return ResponseEntity.ok(ProductResponse.from(
            lifecycleService.receiveProduct(Principal.of(caller), id)));
    }

    @PostMapping("/{id}/dispute")
    public ResponseEntity<ProductResponse> raiseDispute(
            @PathVariable("id") long id,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        return ResponseEntity.ok(ProductResponse.from(
            lifecycleService.raiseDispute(Principal.of(caller), id)));
    }

    @DeleteMapping("/{id}/dispute")
    public ResponseEntity<ProductResponse> resolveDispute(
            @PathVariable("id") long id,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        return ResponseEntity.ok(ProductResponse.from(
            lifecycleService.resolveDispute(Principal.of(caller), id)));
    }
}
