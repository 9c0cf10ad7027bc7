package nik.notes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("nik.notes")
public class NikNotesApplication {

  public static void main(String[] args) {
    SpringApplication.run(NikNotesApplication.class, args);
  }
}
