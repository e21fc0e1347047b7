package ru.tigran.churnpredictor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChurnPredictorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChurnPredictorApplication.class, args);
    }
}
