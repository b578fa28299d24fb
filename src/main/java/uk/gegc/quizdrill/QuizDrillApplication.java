package uk.gegc.quizdrill;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuizDrillApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuizDrillApplication.class, args);
    }
}
