package github.sarthakdev143.pixel_factory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PixelFactoryApplication {

	public static void main(String[] args) {
		SpringApplication.run(PixelFactoryApplication.class, args);
	}

}
