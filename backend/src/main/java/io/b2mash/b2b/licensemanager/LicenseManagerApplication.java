package io.b2mash.b2b.licensemanager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LicenseManagerApplication {

  public static void main(String[] args) {
    SpringApplication.run(LicenseManagerApplication.class, args);
  }
}
