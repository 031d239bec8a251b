package com.williamcallahan.facesearch;

import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.facesearch.service.ProviderRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:facesearch-context;DB_CLOSE_DELAY=-1",
        "app.regeneration.batch-delay=0s"
})
class FaceSearchApplicationTests {

    @Autowired
    ProviderRegistry providerRegistry;

    @Test
    void contextLoads() {
        assertTrue(providerRegistry.getActive().isEmpty());
    }

}
