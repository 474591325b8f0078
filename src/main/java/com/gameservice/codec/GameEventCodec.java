package com.gameservice.codec;

import com.gameservice.codec.exception.DecodeException;
import com.gameservice.codec.exception.ProtocolException;
import com.gameservice.codec.model.ErrorEvent;
import com.gameservice.codec.model.EventType;
import com.gameservice.codec.model.GameEvent;
import com.gameservice.codec.model.InitRequest;
import com.gameservice.codec.model.InitResponse;
import com.gameservice.codec.model.PlayEvent;
import com.gameservice.codec.model.PlayRequest;
import com.gameservice.codec.model.WinEvent;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * @class GameEventCodec
 * @brief WebSocket 텍스트 프레임 ↔ GameEvent 변환기.
 *
 * - decode: 클라이언트 → 서버 메시지(init, play)만 해석. 경계에서 한 번만 검증하고 이후 계층은 타입이 보장된 이벤트만 다룬다.
 * - encode: 모든 이벤트에 대해 실패하지 않는다.
 */
@Component
public class GameEventCodec {

    private static final Logger logger = LoggerFactory.getLogger(GameEventCodec.class);

    static final String TYPE = "type";
    static final String JOIN = "join";
    static final String WATCH = "watch";
    static final String COLUMN = "column";
    static final String ROW = "row";
    static final String PLAYER = "player";
    static final String MESSAGE = "message";

    /**
     * @param raw 수신한 텍스트 프레임
     * @return 검증된 이벤트(InitRequest 또는 PlayRequest)
     * @throws DecodeException   JSON 구문 오류, 최상위가 객체가 아닌 경우
     * @throws ProtocolException type 누락/미지원, 필드 누락/타입 오류
     */
    public GameEvent decode(String raw) {
        if (raw == null) {
            throw new ProtocolException("Empty message.");
        }
        JSONObject json;
        try {
            json = new JSONObject(raw);
        } catch (JSONException e) {
            logger.debug("[decode] JSON 파싱 실패: raw={}, reason={}", raw, e.getMessage());
            throw new DecodeException("Malformed message.", e);
        }

        String tag = requireString(json, TYPE);
        EventType type = EventType.fromTag(tag)
                .orElseThrow(() -> new ProtocolException("Unknown event type: " + tag));
        if (!type.isInbound()) {
            throw new ProtocolException("Unexpected event type: " + tag);
        }

        switch (type) {
            case INIT:
                return decodeInit(json);
            case PLAY:
                return new PlayRequest(requireInt(json, COLUMN));
            default:
                throw new ProtocolException("Unexpected event type: " + tag);
        }
    }

    public String encode(GameEvent event) {
        JSONObject json = new JSONObject();
        json.put(TYPE, event.getType().getTag());

        if (event instanceof InitResponse) {
            InitResponse init = (InitResponse) event;
            json.put(JOIN, init.getJoinToken());
            json.put(WATCH, init.getWatchToken());
        } else if (event instanceof InitRequest) {
            InitRequest init = (InitRequest) event;
            if (init.getJoinToken() != null) json.put(JOIN, init.getJoinToken());
            if (init.getWatchToken() != null) json.put(WATCH, init.getWatchToken());
        } else if (event instanceof PlayEvent) {
            PlayEvent play = (PlayEvent) event;
            json.put(PLAYER, play.getPlayer().getWireName());
            json.put(COLUMN, play.getColumn());
            json.put(ROW, play.getRow());
        } else if (event instanceof PlayRequest) {
            json.put(COLUMN, ((PlayRequest) event).getColumn());
        } else if (event instanceof WinEvent) {
            json.put(PLAYER, ((WinEvent) event).getPlayer().getWireName());
        } else if (event instanceof ErrorEvent) {
            json.put(MESSAGE, ((ErrorEvent) event).getMessage());
        }
        return json.toString();
    }

    // =========================================================================
    // 필드 검증
    // =========================================================================

    private InitRequest decodeInit(JSONObject json) {
        String join = optionalString(json, JOIN);
        String watch = optionalString(json, WATCH);
        if (join != null && watch != null) {
            throw new ProtocolException("Cannot join and watch at the same time.");
        }
        if (join != null) return InitRequest.join(join);
        if (watch != null) return InitRequest.watch(watch);
        return InitRequest.create();
    }

    private String requireString(JSONObject json, String key) {
        String value = optionalString(json, key);
        if (value == null) {
            throw new ProtocolException("Missing field: " + key);
        }
        return value;
    }

    /* 키가 없거나 null 이면 null, 문자열이 아니면 프로토콜 위반 */
    private String optionalString(JSONObject json, String key) {
        Object value = json.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new ProtocolException("Field must be a string: " + key);
        }
        return (String) value;
    }

    private int requireInt(JSONObject json, String key) {
        Object value = json.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            throw new ProtocolException("Missing field: " + key);
        }
        if (!(value instanceof Number)) {
            throw new ProtocolException("Field must be an integer: " + key);
        }
        try {
            // 3.0 같은 정수값 표현은 허용, 3.5 나 int 범위 초과는 거부
            return new BigDecimal(value.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new ProtocolException("Field must be an integer: " + key, e);
        }
    }
}
