package io.apiclient.http.spi;

class ApacheHttpClientAdapterTest extends HttpClientAdapterContractTest {

    @Override
    protected HttpClientAdapter createAdapter() {
        return ApacheHttpClientAdapter.create();
    }

    @Override
    protected void closeAdapter() {
        ((ApacheHttpClientAdapter) adapter).close();
    }
}
