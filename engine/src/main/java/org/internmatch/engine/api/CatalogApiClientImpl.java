package org.internmatch.engine.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.internmatch.engine.api.dto.CatalogResponseDto;
import org.internmatch.engine.api.dto.WeightSettingsDto;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based implementation of CatalogApiClient.
 */
public final class CatalogApiClientImpl implements CatalogApiClient {

    private static final Logger LOG = Logger.getLogger(CatalogApiClientImpl.class.getName());

    private final CatalogApiService api;

    public CatalogApiClientImpl(String baseUrl) {
        this(baseUrl, "");
    }

    /**
     * @param apiToken bearer token for the catalog API; blank means no Authorization header
     */
    public CatalogApiClientImpl(String baseUrl, String apiToken) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS);
        if (apiToken != null && !apiToken.trim().isEmpty()) {
            clientBuilder.addInterceptor(new AuthInterceptor(apiToken.trim()));
        }
        OkHttpClient client = clientBuilder.build();

        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(mapper))
                .client(client)
                .build();

        this.api = retrofit.create(CatalogApiService.class);
    }

    @Override
    public CatalogResponseDto getInternships() {
        return execute(api.getInternships(), "GET v1/internships");
    }

    @Override
    public WeightSettingsDto getWeightSettings() {
        return execute(api.getWeightSettings(), "GET v1/settings/weights");
    }

    /**
     * Execute a Retrofit call and return the result, or null on failure.
     */
    private <T> T execute(Call<T> call, String description) {
        try {
            Response<T> response = call.execute();
            if (response.isSuccessful()) {
                return response.body();
            }
            LOG.warning(() -> String.format("[Catalog] %s failed: %d %s",
                    description, response.code(), response.message()));
            return null;
        } catch (Exception e) {
            LOG.log(Level.WARNING, "[Catalog] " + description + " error", e);
            return null;
        }
    }

    /**
     * Retrofit service interface for the catalog API.
     */
    interface CatalogApiService {
        @GET("v1/internships")
        Call<CatalogResponseDto> getInternships();

        @GET("v1/settings/weights")
        Call<WeightSettingsDto> getWeightSettings();
    }
}
