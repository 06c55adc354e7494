package io.b2mash.b2b.licensemanager.product;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProductRepository extends JpaRepository<Product, UUID> {

  List<Product> findAllByOrderByNameAsc();

  boolean existsByName(String name);

  boolean existsByNameAndIdNot(String name, UUID id);
}
