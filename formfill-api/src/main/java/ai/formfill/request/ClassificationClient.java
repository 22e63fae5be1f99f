package ai.formfill.request;

import java.util.List;

/**
 * Transport to the remote field classification service. Requests are fire-and-forget: {@code start*} returns at once
 * and results, if any, are delivered later through the {@link Observer} on the caller's execution context.
 */
public interface ClassificationClient {

    enum RequestType {
        QUERY,
        UPLOAD
    }

    /** Query for server predictions of the given forms. {@code payload} is opaque to the transport. */
    record QueryRequest(List<String> formSignatures, String payload) {
        public QueryRequest {
            formSignatures = List.copyOf(formSignatures);
        }
    }

    /** Upload of what the user actually entered in one submitted form. */
    record UploadRequest(String formSignature, boolean formWasAutofilled, String payload) {}

    /** Receives responses. Implemented by the engine. */
    interface Observer {
        void onQueryResponse(String responsePayload);

        void onUploadComplete(String formSignature);

        void onRequestError(String formSignature, RequestType requestType, int httpStatus);
    }

    /**
     * @return false when the request was not started, e.g. because an identical request is pending
     */
    boolean startQuery(QueryRequest request);

    boolean startUpload(UploadRequest request);

    void setObserver(Observer observer);

    default boolean isEnabled() {
        return true;
    }

    /** A client that never issues anything; used when server requests are turned off. */
    static ClassificationClient disabled() {
        return Disabled.INSTANCE;
    }

    enum Disabled implements ClassificationClient {
        INSTANCE;

        @Override
        public boolean startQuery(QueryRequest request) {
            return false;
        }

        @Override
        public boolean startUpload(UploadRequest request) {
            return false;
        }

        @Override
        public void setObserver(Observer observer) {}

        @Override
        public boolean isEnabled() {
            return false;
        }
    }
}
