package ru.tigran.gnosisprofiles;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GnosisProfilesApplication {

    public static void main(String[] args) {
        SpringApplication.run(GnosisProfilesApplication.class, args);
    }
}
