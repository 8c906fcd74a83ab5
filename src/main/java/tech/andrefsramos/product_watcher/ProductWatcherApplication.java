package tech.andrefsramos.product_watcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProductWatcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProductWatcherApplication.class, args);
    }
}
