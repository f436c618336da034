package com.promptmenu.common.util;

import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;
import org.bson.types.ObjectId;

/**
 * 문서 ID 검증. 24자리 16진수가 아니면 404가 아닌 400(INVALID_ID_FORMAT)으로 처리한다.
 */
public final class ObjectIds {

    private ObjectIds() {
    }

    /**
     * @param id     검증할 ID
     * @param entity 에러 메시지에 쓰일 문서 이름 (예: "order")
     * @return 검증된 ID 그대로
     */
    public static String requireValid(String id, String entity) {
        if (id == null || !ObjectId.isValid(id)) {
            throw new BusinessException(ErrorCode.INVALID_ID_FORMAT, "Invalid " + entity + " ID format");
        }
        return id;
    }
}
