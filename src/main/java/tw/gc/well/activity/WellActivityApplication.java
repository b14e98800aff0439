package tw.gc.well.activity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WellActivityApplication {

    public static void main(String[] args) {
        SpringApplication.run(WellActivityApplication.class, args);
    }
}
